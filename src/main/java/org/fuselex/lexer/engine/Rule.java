package org.fuselex.lexer.engine;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A pattern and the action taken when it matches at the current offset.
 *
 * @param pattern The compiled pattern. It is only ever tried at a fixed offset, never searched forward.
 * @param action The action to run on a match.
 */
public record Rule(Pattern pattern, RuleAction action) {

    public Rule {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(action, "action");
    }

    @Override
    public String toString() {
        return "/" + pattern.pattern() + "/ -> " + action;
    }
}
