package org.fuselex.lexer.engine;

import org.fuselex.lexer.TokenCategory;

import java.util.List;
import java.util.Objects;

/**
 * What a {@link Rule} does once its pattern matched. The driver dispatches on the variant.
 */
public sealed interface RuleAction
        permits RuleAction.Emit, RuleAction.EmitGroups, RuleAction.Move, RuleAction.Computed, RuleAction.Recurse {

    /**
     * @return The stack change applied after the action emitted its tokens.
     */
    Transition transition();

    /**
     * Emits the whole match as one token.
     * @param category The category of the token.
     * @param transition The stack change applied afterwards.
     */
    record Emit(TokenCategory category, Transition transition) implements RuleAction {
        public Emit {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(transition, "transition");
        }
    }

    /**
     * Emits each capture group as its own token; group {@code i + 1} gets {@code categories.get(i)}.
     * Groups that did not participate in the match emit nothing.
     * @param categories The categories of the groups, in group order.
     * @param transition The stack change applied afterwards.
     */
    record EmitGroups(List<TokenCategory> categories, Transition transition) implements RuleAction {
        public EmitGroups {
            categories = List.copyOf(categories);
            Objects.requireNonNull(transition, "transition");
        }
    }

    /**
     * Only changes the state stack. Usually paired with a zero-length pattern.
     * @param transition The stack change.
     */
    record Move(Transition transition) implements RuleAction {
        public Move {
            Objects.requireNonNull(transition, "transition");
        }
    }

    /**
     * Delegates to a callback that emits tokens and changes state itself.
     * @param callback The callback.
     */
    record Computed(IRuleCallback callback) implements RuleAction {
        public Computed {
            Objects.requireNonNull(callback, "callback");
        }

        @Override
        public Transition transition() {
            return Transition.NONE;
        }
    }

    /**
     * Tokenizes the match again, starting from the grammar's recursion state.
     * @param transition The stack change applied afterwards.
     */
    record Recurse(Transition transition) implements RuleAction {
        public Recurse {
            Objects.requireNonNull(transition, "transition");
        }
    }
}
