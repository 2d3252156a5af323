package org.fuselex.lexer.engine;

import org.fuselex.diagnostics.DiagnosticsEngine;
import org.fuselex.lexer.Token;
import org.fuselex.lexer.TokenStreams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Drives a {@link Grammar} over a document.
 * <p>
 * Every call starts an independent run with a fresh state stack and string register, so one
 * instance can tokenize any number of documents, also concurrently. The produced tokens cover
 * the input exactly once and in order; tokenization never fails; characters no rule accepts
 * become single {@link org.fuselex.lexer.TokenCategory#ERROR} tokens.
 */
public class RegexLexer {

    private static final Logger LOG = LoggerFactory.getLogger(RegexLexer.class);

    private final Grammar grammar;

    /**
     * Creates a lexer for a grammar.
     * @param grammar The state table to run.
     */
    public RegexLexer(Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
    }

    /**
     * Tokenizes a whole document, starting from the grammar's initial state.
     * @param source The document.
     * @return A lazy, single-use iterator over the tokens.
     */
    public Iterator<Token> tokenize(String source) {
        return tokenize(source, null);
    }

    /**
     * Tokenizes a whole document and reports unrecognized input as warnings.
     * @param source The document.
     * @param diagnostics Receives one warning per unrecognized character; may be {@code null}.
     * @return A lazy, single-use iterator over the tokens.
     */
    public Iterator<Token> tokenize(String source, DiagnosticsEngine diagnostics) {
        Objects.requireNonNull(source, "source");
        LOG.debug("Tokenizing {} characters from state '{}'.", source.length(), grammar.initialState().name());
        return new TokenRun(grammar, source, 0, source.length(), grammar.initialState(),
                diagnostics, new SourcePositions(source), false);
    }

    /**
     * Tokenizes a document from the recursion state, as if it were a re-tokenized substring.
     * @param source The text.
     * @return A lazy, single-use iterator over the tokens.
     */
    public Iterator<Token> tokenizeFragment(String source) {
        Objects.requireNonNull(source, "source");
        return new TokenRun(grammar, source, 0, source.length(), grammar.recursionState(),
                null, new SourcePositions(source), true);
    }

    /**
     * Same as {@link #tokenize(String)}, exposed as a sequential stream.
     * @param source The document.
     * @return A lazy stream of tokens.
     */
    public Stream<Token> stream(String source) {
        return TokenStreams.stream(tokenize(source));
    }
}
