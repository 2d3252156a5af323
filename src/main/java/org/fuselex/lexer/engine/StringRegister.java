package org.fuselex.lexer.engine;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Tracks the open quoted strings of one run, innermost last, so that a quote character can
 * be checked against the delimiter that actually opened the string it appears in.
 */
public final class StringRegister {

    private final Deque<StringContext> open = new ArrayDeque<>();

    /**
     * Records a newly opened string.
     * @param prefix The literal prefix as written; stored lower-cased.
     * @param delimiter The opening quote.
     */
    public void open(String prefix, char delimiter) {
        open.push(new StringContext(prefix.toLowerCase(Locale.ROOT), delimiter));
    }

    /**
     * @param quote A quote character found inside a string.
     * @return {@code true} if it is the delimiter of the innermost open string.
     */
    public boolean closes(char quote) {
        StringContext innermost = open.peek();
        return innermost != null && innermost.delimiter() == quote;
    }

    /**
     * Forgets the innermost open string. Does nothing if no string is open.
     */
    public void close() {
        open.poll();
    }

    /**
     * @return The innermost open string, or {@code null} if none is open.
     */
    public StringContext peek() {
        return open.peek();
    }

    public int depth() {
        return open.size();
    }
}
