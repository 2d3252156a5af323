package org.fuselex.lexer.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The stack of active lexer states of one run. The top of the stack is the state whose
 * rules are tried next. The bottom frame is never removed.
 */
public final class StateStack {

    private static final Logger LOG = LoggerFactory.getLogger(StateStack.class);

    private final List<LexerState> frames = new ArrayList<>();

    /**
     * Creates a stack with a single frame.
     * @param bottom The state the run starts in.
     */
    public StateStack(LexerState bottom) {
        frames.add(bottom);
    }

    public LexerState top() {
        return frames.get(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    public void push(LexerState state) {
        frames.add(state);
    }

    /**
     * Removes the top frame. Popping the last frame is ignored.
     * @return {@code true} if a frame was removed.
     */
    public boolean pop() {
        if (frames.size() == 1) {
            LOG.debug("Ignoring pop of the last lexer state '{}'.", top().name());
            return false;
        }
        frames.remove(frames.size() - 1);
        return true;
    }

    /**
     * Replaces the top frame.
     * @param state The new top state.
     */
    public void replaceTop(LexerState state) {
        frames.set(frames.size() - 1, state);
    }

    /**
     * @return The state names from bottom to top.
     */
    public List<String> names() {
        return frames.stream().map(LexerState::name).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.join(" > ", names());
    }
}
