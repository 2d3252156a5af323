package org.fuselex.lexer.fuse;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * The names classified as {@link org.fuselex.lexer.TokenCategory#NAME_BUILTIN}.
 */
public final class BuiltinNames {

    /** The name that opens a pattern argument; handled separately from the set below. */
    public static final String GSUB = "gsub";

    /** Built-in types, modules and functions, as shipped with the language. */
    public static final Set<String> DEFAULT = Set.of(
            "number", "string", "ustring", "any", "unknown", "never", "unsafe", "default", "namespace",
            "_G", "_VERSION", "assert", "assert_eq", "collectgarbage", "dofile", "error", "getmetatable",
            "ipairs", "load", "loadfile", "next", "pairs", "pcall", "print", "rawequal", "rawget", "rawlen",
            "rawset", "select", "setmetatable", "tonumber", "tostring", "xpcall", "typeof"
    );

    private BuiltinNames() {}

    /**
     * Computes the set the lexer classifies against.
     * @param functionHighlighting Whether built-in names are classified at all.
     * @param disabledModules Names to leave unclassified.
     * @return An immutable set; empty when highlighting is off.
     */
    public static Set<String> effective(boolean functionHighlighting, Collection<String> disabledModules) {
        if (!functionHighlighting) {
            return Set.of();
        }
        Set<String> names = new HashSet<>(DEFAULT);
        names.removeAll(disabledModules);
        return Set.copyOf(names);
    }
}
