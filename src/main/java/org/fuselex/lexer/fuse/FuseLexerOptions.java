package org.fuselex.lexer.fuse;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Set;

/**
 * User-facing switches of the Fuse lexer.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * fuselex.lexer {
 *   function-highlighting = true   # classify built-in names as Name.Builtin
 *   disabled-modules = []          # built-in names to treat as plain names
 * }
 * </pre>
 *
 * @param functionHighlighting Whether built-in names get their own category.
 * @param disabledModules Built-in names excluded from classification.
 */
public record FuseLexerOptions(boolean functionHighlighting, List<String> disabledModules) {

    /** The configuration path of the lexer options. */
    public static final String CONFIG_PATH = "fuselex.lexer";

    /** Highlighting on, nothing disabled. */
    public static final FuseLexerOptions DEFAULTS = new FuseLexerOptions(true, List.of());

    public FuseLexerOptions {
        disabledModules = List.copyOf(disabledModules);
    }

    /**
     * Reads the options from the {@code fuselex.lexer} block; missing keys keep their defaults.
     * @param config The application configuration.
     * @return The options.
     */
    public static FuseLexerOptions fromConfig(Config config) {
        if (!config.hasPath(CONFIG_PATH)) {
            return DEFAULTS;
        }
        Config lexer = config.getConfig(CONFIG_PATH);
        boolean highlighting = lexer.hasPath("function-highlighting")
                ? lexer.getBoolean("function-highlighting")
                : DEFAULTS.functionHighlighting();
        List<String> disabled = lexer.hasPath("disabled-modules")
                ? lexer.getStringList("disabled-modules")
                : DEFAULTS.disabledModules();
        return new FuseLexerOptions(highlighting, disabled);
    }

    public FuseLexerOptions withFunctionHighlighting(boolean enabled) {
        return new FuseLexerOptions(enabled, disabledModules);
    }

    public FuseLexerOptions withDisabledModules(List<String> modules) {
        return new FuseLexerOptions(functionHighlighting, modules);
    }

    /**
     * @return The built-in names the lexer classifies under these options.
     */
    public Set<String> effectiveBuiltins() {
        return BuiltinNames.effective(functionHighlighting, disabledModules);
    }

    /**
     * @return Whether {@code gsub} itself is classified as a built-in.
     */
    public boolean highlightsGsub() {
        return functionHighlighting && !disabledModules.contains(BuiltinNames.GSUB);
    }
}
