package org.fuselex.lexer.engine;

import org.fuselex.lexer.TokenCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * An immutable table of lexer states.
 * <p>
 * A grammar names the state every run starts in and the state a recursive run
 * (re-tokenizing a substring) starts in. Grammars are built once and shared freely
 * between threads; all mutable data lives in the individual runs.
 */
public final class Grammar {

    private static final Logger LOG = LoggerFactory.getLogger(Grammar.class);

    private final Map<String, LexerState> states;
    private final String initialState;
    private final String recursionState;

    private Grammar(Map<String, LexerState> states, String initialState, String recursionState) {
        this.states = Collections.unmodifiableMap(states);
        this.initialState = initialState;
        this.recursionState = recursionState;
    }

    /**
     * Starts a new grammar.
     * @param initialState The state a run over a whole document starts in.
     * @param recursionState The state a run over a re-tokenized substring starts in.
     * @return A builder.
     */
    public static Builder builder(String initialState, String recursionState) {
        return new Builder(initialState, recursionState);
    }

    /**
     * Looks up a state.
     * @param name The state name.
     * @return The state.
     * @throws GrammarDefinitionException if the grammar has no such state.
     */
    public LexerState state(String name) {
        LexerState state = states.get(name);
        if (state == null) {
            throw new GrammarDefinitionException("Unknown lexer state: " + name);
        }
        return state;
    }

    /**
     * @param name The state name.
     * @return {@code true} if the grammar defines the state.
     */
    public boolean hasState(String name) {
        return states.containsKey(name);
    }

    /**
     * @return All state names, in definition order.
     */
    public Set<String> stateNames() {
        return states.keySet();
    }

    public LexerState initialState() {
        return states.get(initialState);
    }

    public LexerState recursionState() {
        return states.get(recursionState);
    }

    /**
     * Assembles a {@link Grammar}. States may be defined in any order; mixins and
     * transition targets are resolved and checked in {@link #build()}.
     */
    public static final class Builder {
        private final String initialState;
        private final String recursionState;
        private final Map<String, StateBuilder> definitions = new LinkedHashMap<>();

        private Builder(String initialState, String recursionState) {
            this.initialState = initialState;
            this.recursionState = recursionState;
        }

        /**
         * Defines a state.
         * @param name The unique state name.
         * @param body Adds the rules of the state, in priority order.
         * @return This builder.
         * @throws GrammarDefinitionException if the state was already defined.
         */
        public Builder state(String name, Consumer<StateBuilder> body) {
            if (definitions.containsKey(name)) {
                throw new GrammarDefinitionException("Lexer state defined twice: " + name);
            }
            StateBuilder state = new StateBuilder(name);
            body.accept(state);
            definitions.put(name, state);
            return this;
        }

        /**
         * Resolves mixins and validates the table.
         * @return The immutable grammar.
         * @throws GrammarDefinitionException if a mixin or transition names an unknown state,
         *         mixins form a cycle, or the initial or recursion state is missing.
         */
        public Grammar build() {
            requireDefined(initialState, "initial state");
            requireDefined(recursionState, "recursion state");

            Map<String, List<Rule>> resolved = new HashMap<>();
            Map<String, LexerState> states = new LinkedHashMap<>();
            for (String name : definitions.keySet()) {
                List<Rule> rules = resolve(name, resolved, new LinkedHashSet<>());
                for (Rule rule : rules) {
                    validateTarget(name, rule.action().transition());
                }
                states.put(name, new LexerState(name, rules));
            }
            LOG.debug("Built grammar with {} states (initial '{}', recursion '{}').",
                    states.size(), initialState, recursionState);
            return new Grammar(states, initialState, recursionState);
        }

        private List<Rule> resolve(String name, Map<String, List<Rule>> resolved, Set<String> visiting) {
            List<Rule> done = resolved.get(name);
            if (done != null) {
                return done;
            }
            if (!visiting.add(name)) {
                throw new GrammarDefinitionException("Mixin cycle through lexer states " + visiting);
            }
            StateBuilder definition = definitions.get(name);
            List<Rule> rules = new ArrayList<>();
            for (Object entry : definition.entries) {
                if (entry instanceof Rule rule) {
                    rules.add(rule);
                } else {
                    String mixin = (String) entry;
                    if (!definitions.containsKey(mixin)) {
                        throw new GrammarDefinitionException(
                                "State '" + name + "' mixes in unknown state '" + mixin + "'");
                    }
                    rules.addAll(resolve(mixin, resolved, visiting));
                }
            }
            visiting.remove(name);
            resolved.put(name, rules);
            return rules;
        }

        private void validateTarget(String owner, Transition transition) {
            String target = null;
            if (transition instanceof Transition.Push push) {
                target = push.state();
            } else if (transition instanceof Transition.Goto goTo) {
                target = goTo.state();
            }
            if (target != null && !definitions.containsKey(target)) {
                throw new GrammarDefinitionException(
                        "State '" + owner + "' transitions to unknown state '" + target + "'");
            }
        }

        private void requireDefined(String name, String role) {
            if (!definitions.containsKey(name)) {
                throw new GrammarDefinitionException("The " + role + " '" + name + "' is not defined");
            }
        }
    }

    /**
     * Collects the rules of one state.
     */
    public static final class StateBuilder {
        private final String name;
        // Either a Rule or the name of a state to mix in.
        private final List<Object> entries = new ArrayList<>();

        private StateBuilder(String name) {
            this.name = name;
        }

        /**
         * Emits the whole match as one token.
         */
        public StateBuilder rule(String regex, TokenCategory category) {
            return rule(regex, category, Transition.NONE);
        }

        /**
         * Emits the whole match as one token, then changes state.
         */
        public StateBuilder rule(String regex, TokenCategory category, Transition transition) {
            return add(regex, new RuleAction.Emit(category, transition));
        }

        /**
         * Hands the match to a callback.
         */
        public StateBuilder rule(String regex, IRuleCallback callback) {
            return add(regex, new RuleAction.Computed(callback));
        }

        /**
         * Emits one token per capture group.
         */
        public StateBuilder groups(String regex, TokenCategory... categories) {
            return groups(regex, Transition.NONE, categories);
        }

        /**
         * Emits one token per capture group, then changes state.
         */
        public StateBuilder groups(String regex, Transition transition, TokenCategory... categories) {
            return add(regex, new RuleAction.EmitGroups(List.of(categories), transition));
        }

        /**
         * Changes state without emitting anything.
         */
        public StateBuilder move(String regex, Transition transition) {
            return add(regex, new RuleAction.Move(transition));
        }

        /**
         * Tokenizes the match again from the recursion state.
         */
        public StateBuilder recurse(String regex) {
            return add(regex, new RuleAction.Recurse(Transition.NONE));
        }

        /**
         * Copies the rules of another state in at this position.
         */
        public StateBuilder mixin(String stateName) {
            entries.add(stateName);
            return this;
        }

        private StateBuilder add(String regex, RuleAction action) {
            Pattern pattern;
            try {
                pattern = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new GrammarDefinitionException("Invalid pattern in state '" + name + "': " + regex, e);
            }
            entries.add(new Rule(pattern, action));
            return this;
        }
    }
}
