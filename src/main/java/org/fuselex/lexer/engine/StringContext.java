package org.fuselex.lexer.engine;

/**
 * Records how the innermost open string literal was opened.
 *
 * @param prefix The lower-cased literal prefix, {@code ""} or {@code "u"}.
 * @param delimiter The opening quote character; only the same character closes the string.
 */
public record StringContext(String prefix, char delimiter) {

    public boolean isUnicode() {
        return prefix.indexOf('u') >= 0;
    }
}
