package org.fuselex.lexer;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Helpers for working with lazily produced token sequences.
 */
public final class TokenStreams {

    private TokenStreams() {}

    /**
     * Wraps a token iterator so that adjacent tokens of the same category are merged into one.
     * The merge happens lazily: the returned iterator reads ahead by at most one token.
     * @param tokens The source tokens.
     * @return An iterator over the coalesced tokens.
     */
    public static Iterator<Token> coalesce(Iterator<Token> tokens) {
        return new CoalescingIterator(tokens);
    }

    /**
     * Exposes a token iterator as a sequential stream.
     * @param tokens The source tokens.
     * @return A sequential, ordered stream.
     */
    public static Stream<Token> stream(Iterator<Token> tokens) {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(tokens, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Concatenates the text of the given tokens.
     * @param tokens The tokens.
     * @return The joined text.
     */
    public static String concat(Iterable<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.text());
        }
        return sb.toString();
    }

    private static final class CoalescingIterator implements Iterator<Token> {
        private final Iterator<Token> source;
        private Token lookahead;

        CoalescingIterator(Iterator<Token> source) {
            this.source = source;
        }

        @Override
        public boolean hasNext() {
            return lookahead != null || source.hasNext();
        }

        @Override
        public Token next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Token first = lookahead != null ? lookahead : source.next();
            lookahead = null;

            StringBuilder text = null;
            while (source.hasNext()) {
                Token candidate = source.next();
                if (candidate.category() != first.category()) {
                    lookahead = candidate;
                    break;
                }
                if (text == null) {
                    text = new StringBuilder(first.text());
                }
                text.append(candidate.text());
            }
            return text == null ? first : new Token(first.category(), text.toString(), first.offset());
        }
    }
}
