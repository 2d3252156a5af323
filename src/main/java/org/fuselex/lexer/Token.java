package org.fuselex.lexer;

import java.util.Objects;

/**
 * Represents a single classified span of the source document.
 *
 * @param category The category of the token (e.g., Keyword, Name, Literal.String).
 * @param text The exact text of the token from the source document.
 * @param offset The index of the first character of the token within the document.
 */
public record Token(
        TokenCategory category,
        String text,
        int offset
) {
    public Token {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(text, "text");
    }

    /**
     * @return The index just past the last character of the token.
     */
    public int end() {
        return offset + text.length();
    }

    @Override
    public String toString() {
        return category.qualifiedName() + "(" + text + ")@" + offset;
    }
}
