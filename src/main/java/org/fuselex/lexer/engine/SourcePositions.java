package org.fuselex.lexer.engine;

/**
 * Converts document offsets into 1-based line and column numbers.
 * Lookups are expected in mostly increasing order and scan forward incrementally.
 */
final class SourcePositions {

    private final CharSequence source;
    private int scanned = 0;
    private int line = 1;
    private int lineStart = 0;

    SourcePositions(CharSequence source) {
        this.source = source;
    }

    /**
     * @param offset A document offset.
     * @return {@code {line, column}}.
     */
    int[] positionOf(int offset) {
        if (offset < scanned) {
            scanned = 0;
            line = 1;
            lineStart = 0;
        }
        for (; scanned < offset; scanned++) {
            if (source.charAt(scanned) == '\n') {
                line++;
                lineStart = scanned + 1;
            }
        }
        return new int[]{line, offset - lineStart + 1};
    }
}
