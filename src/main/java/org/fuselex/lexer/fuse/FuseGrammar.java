package org.fuselex.lexer.fuse;

import org.fuselex.lexer.engine.Grammar;
import org.fuselex.lexer.engine.IRuleCallback;
import org.fuselex.lexer.engine.Transition;

import java.util.Set;

import static org.fuselex.lexer.TokenCategory.*;

/**
 * The state table of the Fuse language.
 * <p>
 * Lexing starts in {@code root}, which only recognizes a shebang line and then enters
 * {@code base} for the rest of the document. Strings, interpolations, function headers and
 * {@code gsub} pattern arguments each get their own states on top of {@code base}.
 */
public final class FuseGrammar {

    public static final String ROOT = "root";
    public static final String BASE = "base";
    public static final String FUNCTION_NAME = "function_name";
    public static final String GSUB = "gsub";
    public static final String GSUB_ARGS = "gsub_args";
    public static final String REGEX = "regex";
    public static final String REGEX_END = "regex_end";
    public static final String REGEX_GROUP = "regex_group";
    public static final String GENERIC_ESCAPE = "generic_escape";
    public static final String GENERIC_STRING = "generic_string";
    public static final String GENERIC_INTERPOL = "generic_interpol";

    private static final String IDENT = "[A-Za-z_][A-Za-z0-9_]*";

    private FuseGrammar() {}

    /**
     * Builds the grammar for a set of options.
     * @param options The lexer options; they only affect identifier classification.
     * @return The grammar.
     */
    public static Grammar create(FuseLexerOptions options) {
        Set<String> builtins = options.effectiveBuiltins();
        boolean gsubIsBuiltin = options.highlightsGsub();

        return Grammar.builder(ROOT, BASE)
                .state(ROOT, s -> s
                        .rule("#![^\\n]*", COMMENT_PREPROC)
                        .move("", Transition.push(BASE)))

                .state(BASE, s -> s
                        // --[==[ ... ]==], closed only by the same number of '='
                        .rule("(?s)--\\[(=*)\\[.*?\\]\\1\\]", COMMENT_MULTILINE)
                        .rule("--[^\\n]*", COMMENT_SINGLE)

                        .rule("(?i)(?:\\d[\\d_]*)?\\.\\d[\\d_]*(?:e[+-]?\\d+)?"
                                + "|\\d[\\d_]*\\.(?!\\.)[\\d_]*(?:e[+-]?\\d+)?", NUMBER_FLOAT)
                        .rule("(?i)\\d[\\d_]*e[+-]?\\d+", NUMBER_FLOAT)
                        .rule("(?i)0x[0-9a-f_]*", NUMBER_HEX)
                        .rule("(?i)0b[01_]*", NUMBER_BIN)
                        .rule("\\d[\\d_]*", NUMBER_INTEGER)

                        .rule("\\n", TEXT)
                        .rule("[^\\S\\n]+", TEXT)

                        .rule("\\.\\.\\.|\\.\\.|==|!=|<=|>=|<<|>>|[?&|!=+\\-*/%^<>#]", OPERATOR)
                        .rule("[\\[\\]{}().,:;]", PUNCTUATION)
                        .rule("(?:and|or|not)\\b", OPERATOR_WORD)

                        .rule("(?:break|do|else|elseif|end|for|if|in|repeat|return|then|until|while)\\b", KEYWORD)
                        .rule("(?:as|enum|struct|type|trait|impl|union|import|from|export|match|when|is"
                                + "|try|catch|finally|pub|unsafe)\\b", KEYWORD)
                        .rule("(?:const|let|static)\\b", KEYWORD_DECLARATION)
                        .rule("(?:true|false|nil)\\b", KEYWORD_CONSTANT)

                        .rule("(?:function|fn)\\b", KEYWORD, Transition.push(FUNCTION_NAME))

                        .rule("([uU]?)(['\"])", openString())
                        // r"..." and ur#'...'#: verbatim up to the quote and fence that opened it
                        .rule("(?s)(u?r)(#*)([\"']).*?\\3\\2", STRING)

                        .rule(IDENT + "(?:\\." + IDENT + ")?", identifier(builtins, gsubIsBuiltin)))

                .state(FUNCTION_NAME, s -> s
                        .rule("\\s+", TEXT)
                        .groups("(?:(" + IDENT + ")(\\.))?(" + IDENT + ")", Transition.POP,
                                NAME_CLASS, PUNCTUATION, NAME_FUNCTION)
                        // inline function: leave the parenthesis to base
                        .move("(?=\\()", Transition.POP)
                        .move("", Transition.POP))

                .state(GSUB, s -> s
                        .rule("[^\\S\\n]+", TEXT)
                        .rule("\\(", PUNCTUATION, Transition.goTo(GSUB_ARGS))
                        .move("", Transition.POP))

                .state(GSUB_ARGS, s -> s
                        .rule("\\)", PUNCTUATION, Transition.POP)
                        .rule("\\(", PUNCTUATION, Transition.push(GSUB_ARGS))
                        .rule(",", PUNCTUATION)
                        .rule("\\s+", TEXT)
                        .rule("\"", STRING_REGEX, Transition.push(REGEX))
                        // possessive and unrolled: no backtracking frame per character
                        .recurse("'[^'\\\\\\n]*+(?:\\\\.[^'\\\\\\n]*+)*+'")
                        .recurse("[^\"(),\\s]+"))

                .state(REGEX, s -> s
                        .rule("\"", STRING_REGEX, Transition.goTo(REGEX_END))
                        .rule("\\[\\^?", STRING_ESCAPE, Transition.push(REGEX_GROUP))
                        .rule("(?s)\\\\.", STRING_ESCAPE)
                        .rule("\\(\\?[:=<!]", STRING_ESCAPE)
                        .rule("\\{[\\d,]+\\}", STRING_ESCAPE)
                        .rule("[()?]", STRING_ESCAPE)
                        .rule("[\\^$.*+|]", STRING_ESCAPE)
                        .rule("(?s).", STRING_REGEX))

                .state(REGEX_END, s -> s
                        .rule("\\$+", STRING_REGEX, Transition.POP)
                        .move("", Transition.POP))

                .state(REGEX_GROUP, s -> s
                        .rule("/", STRING_ESCAPE)
                        .rule("\\]", STRING_ESCAPE, Transition.POP)
                        .move("(?=\")", Transition.POP)
                        .groups("(?s)(\\\\)(.)", STRING_ESCAPE, STRING_REGEX)
                        .rule("(?s).", STRING_REGEX))

                .state(GENERIC_ESCAPE, s -> s
                        .rule("\\\\(?:\\d{1,3}|[nrt\\\\\"'0\\s]|x[0-9a-fA-F]{2}|u[0-9a-fA-F]{4}|U[0-9a-fA-F]{8})",
                                STRING_ESCAPE))

                .state(GENERIC_STRING, s -> s
                        .mixin(GENERIC_ESCAPE)
                        .rule("['\"]", quote())
                        .rule("\\$\\{", STRING_INTERPOL, Transition.push(GENERIC_INTERPOL))
                        .rule("[^'\"\\\\$]+", STRING)
                        .rule("\\$", STRING))

                .state(GENERIC_INTERPOL, s -> s
                        .recurse("[^${}]+")
                        .rule("\\$\\{", STRING_INTERPOL, Transition.push(GENERIC_INTERPOL))
                        .rule("\\}", STRING_INTERPOL, Transition.POP)
                        .recurse("[${]"))

                .build();
    }

    private static IRuleCallback openString() {
        return (match, context) -> {
            context.token(STRING, match.group());
            context.strings().open(match.group(1), match.group(2).charAt(0));
            context.push(GENERIC_STRING);
        };
    }

    private static IRuleCallback quote() {
        return (match, context) -> {
            char quote = match.group().charAt(0);
            context.token(STRING, match.group());
            if (context.strings().closes(quote)) {
                context.strings().close();
                context.pop();
            }
        };
    }

    private static IRuleCallback identifier(Set<String> builtins, boolean gsubIsBuiltin) {
        return (match, context) -> {
            String name = match.group();
            if (BuiltinNames.GSUB.equals(name)) {
                context.token(gsubIsBuiltin ? NAME_BUILTIN : NAME, name);
                context.push(GSUB);
            } else if (builtins.contains(name)) {
                context.token(NAME_BUILTIN, name);
            } else {
                int dot = name.indexOf('.');
                if (dot >= 0) {
                    // member access
                    context.token(NAME, name.substring(0, dot));
                    context.token(PUNCTUATION, ".");
                    context.token(NAME, name.substring(dot + 1));
                } else {
                    context.token(NAME, name);
                }
            }
        };
    }
}
