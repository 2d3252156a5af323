package org.fuselex.lexer;

/**
 * Defines the closed set of categories a {@link Token} can be classified as.
 * <p>
 * Categories form a small hierarchy: every category except {@link #TEXT} and {@link #ERROR}
 * may have a parent, so that callers can treat e.g. {@link #KEYWORD_DECLARATION} as a
 * {@link #KEYWORD}. Each category also carries the short class name conventionally used
 * by highlighters.
 */
public enum TokenCategory {
    /** Whitespace and other text without a meaning of its own. */
    TEXT("Text", "", null),
    /** A character no rule of the active state could match. */
    ERROR("Error", "err", null),

    // Comments.
    /** Base category for comments. */
    COMMENT("Comment", "c", null),
    /** A comment running to the end of the line. */
    COMMENT_SINGLE("Comment.Single", "c1", COMMENT),
    /** A long-bracket block comment. */
    COMMENT_MULTILINE("Comment.Multiline", "cm", COMMENT),
    /** A shebang line at the very start of the document. */
    COMMENT_PREPROC("Comment.Preproc", "cp", COMMENT),

    // Keywords.
    /** A reserved word. */
    KEYWORD("Keyword", "k", null),
    /** A declaration keyword, such as {@code let}. */
    KEYWORD_DECLARATION("Keyword.Declaration", "kd", KEYWORD),
    /** A constant keyword, such as {@code nil}. */
    KEYWORD_CONSTANT("Keyword.Constant", "kc", KEYWORD),

    // Operators and punctuation.
    /** A symbolic operator. */
    OPERATOR("Operator", "o", null),
    /** A word operator: {@code and}, {@code or}, {@code not}. */
    OPERATOR_WORD("Operator.Word", "ow", OPERATOR),
    /** Brackets, separators and the member-access dot. */
    PUNCTUATION("Punctuation", "p", null),

    // Numbers.
    /** Base category for numeric literals. */
    NUMBER("Literal.Number", "m", null),
    /** A decimal integer literal. */
    NUMBER_INTEGER("Literal.Number.Integer", "mi", NUMBER),
    /** A floating point literal. */
    NUMBER_FLOAT("Literal.Number.Float", "mf", NUMBER),
    /** A {@code 0x} literal. */
    NUMBER_HEX("Literal.Number.Hex", "mh", NUMBER),
    /** A {@code 0b} literal. */
    NUMBER_BIN("Literal.Number.Bin", "mb", NUMBER),

    // Strings.
    /** Quotes and plain string content. */
    STRING("Literal.String", "s", null),
    /** An escape sequence inside a string, or a metacharacter inside a regex literal. */
    STRING_ESCAPE("Literal.String.Escape", "se", STRING),
    /** The delimiters of an interpolated expression. */
    STRING_INTERPOL("Literal.String.Interpol", "si", STRING),
    /** Literal characters and quotes of a pattern argument. */
    STRING_REGEX("Literal.String.Regex", "sr", STRING),

    // Names.
    /** An identifier. */
    NAME("Name", "n", null),
    /** A built-in function or module name. */
    NAME_BUILTIN("Name.Builtin", "nb", NAME),
    /** The class part of a {@code function Class.method} declaration. */
    NAME_CLASS("Name.Class", "nc", NAME),
    /** The name of a declared function. */
    NAME_FUNCTION("Name.Function", "nf", NAME);

    private final String qualifiedName;
    private final String shortName;
    private final TokenCategory parent;

    TokenCategory(String qualifiedName, String shortName, TokenCategory parent) {
        this.qualifiedName = qualifiedName;
        this.shortName = shortName;
        this.parent = parent;
    }

    /**
     * @return The dotted name of the category, e.g. {@code Literal.String.Escape}.
     */
    public String qualifiedName() {
        return qualifiedName;
    }

    /**
     * @return The short highlighter class name, e.g. {@code se}. Empty for {@link #TEXT}.
     */
    public String shortName() {
        return shortName;
    }

    /**
     * @return The parent category, or {@code null} for a top-level category.
     */
    public TokenCategory parent() {
        return parent;
    }

    /**
     * Checks whether this category is the given category or one of its descendants.
     * @param other The category to test against.
     * @return {@code true} if this category equals {@code other} or descends from it.
     */
    public boolean isA(TokenCategory other) {
        for (TokenCategory c = this; c != null; c = c.parent) {
            if (c == other) {
                return true;
            }
        }
        return false;
    }

    /**
     * Looks up a category by its qualified name.
     * @param qualifiedName The dotted name, e.g. {@code Name.Builtin}.
     * @return The matching category.
     * @throws IllegalArgumentException if no category has that name.
     */
    public static TokenCategory fromQualifiedName(String qualifiedName) {
        for (TokenCategory category : values()) {
            if (category.qualifiedName.equals(qualifiedName)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown token category: " + qualifiedName);
    }

    @Override
    public String toString() {
        return qualifiedName;
    }
}
