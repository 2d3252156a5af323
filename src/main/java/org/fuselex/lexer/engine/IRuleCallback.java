package org.fuselex.lexer.engine;

import java.util.regex.MatchResult;

/**
 * Computes the outcome of a rule from the text it matched.
 * Used where a fixed category is not enough, e.g. to classify an identifier against the
 * built-in names or to decide whether a quote closes the innermost string.
 */
@FunctionalInterface
public interface IRuleCallback {

    /**
     * Handles a match.
     * @param match The match. Only valid for the duration of the call.
     * @param context The run the match belongs to; used to emit tokens and change state.
     */
    void apply(MatchResult match, LexerContext context);
}
