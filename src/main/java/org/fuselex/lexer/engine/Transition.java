package org.fuselex.lexer.engine;

/**
 * A change to the state stack requested by a rule after it matched.
 */
public sealed interface Transition permits Transition.None, Transition.Push, Transition.Pop, Transition.Goto {

    /** Leaves the state stack unchanged. */
    Transition NONE = new None();

    /** Returns to the previous state. */
    Transition POP = new Pop();

    /**
     * Enters a nested state.
     * @param state The name of the state to push.
     * @return The transition.
     */
    static Transition push(String state) {
        return new Push(state);
    }

    /**
     * Replaces the current state without growing the stack.
     * @param state The name of the state that replaces the top of the stack.
     * @return The transition.
     */
    static Transition goTo(String state) {
        return new Goto(state);
    }

    /** No stack change. */
    record None() implements Transition {}

    /**
     * Pushes a state.
     * @param state The name of the state.
     */
    record Push(String state) implements Transition {}

    /** Pops the current state. */
    record Pop() implements Transition {}

    /**
     * Replaces the top of the stack.
     * @param state The name of the state.
     */
    record Goto(String state) implements Transition {}
}
