package org.fuselex.diagnostics;

/**
 * Represents a single warning produced while tokenizing a document. Tokenization always
 * recovers, so every diagnostic describes input that was accepted as an error token.
 *
 * @param message The diagnostic message.
 * @param sourceName The logical name of the document, e.g. its file name.
 * @param offset The character offset the diagnostic refers to.
 * @param line The 1-based line number of the offset.
 * @param column The 1-based column number of the offset.
 */
public record Diagnostic(
        String message,
        String sourceName,
        int offset,
        int line,
        int column
) {
    @Override
    public String toString() {
        return String.format("[WARNING] %s:%d:%d: %s", sourceName, line, column, message);
    }
}
