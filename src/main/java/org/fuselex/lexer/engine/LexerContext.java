package org.fuselex.lexer.engine;

import org.fuselex.lexer.TokenCategory;

/**
 * The view of a running tokenization offered to {@link IRuleCallback}s.
 */
public interface LexerContext {

    /**
     * Emits a token. Empty text emits nothing.
     * @param category The token category.
     * @param text The token text; must be the next unconsumed part of the match.
     */
    void token(TokenCategory category, String text);

    /**
     * Enters a nested state.
     * @param state The state name.
     */
    void push(String state);

    /**
     * Returns to the previous state. Ignored when only the bottom state is left.
     */
    void pop();

    /**
     * Replaces the current state.
     * @param state The state name.
     */
    void goTo(String state);

    /**
     * @return The register of open quoted strings of this run.
     */
    StringRegister strings();
}
