package org.fuselex.lexer.engine;

import java.util.List;

/**
 * A named, ordered list of rules. Rules are tried top to bottom and the first match wins.
 *
 * @param name The unique name of the state within its grammar.
 * @param rules The rules, in priority order.
 */
public record LexerState(String name, List<Rule> rules) {

    public LexerState {
        rules = List.copyOf(rules);
    }

    @Override
    public String toString() {
        return "LexerState[" + name + ", " + rules.size() + " rules]";
    }
}
