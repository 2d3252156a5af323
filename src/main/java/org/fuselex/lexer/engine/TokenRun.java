package org.fuselex.lexer.engine;

import org.fuselex.diagnostics.DiagnosticsEngine;
import org.fuselex.lexer.Token;
import org.fuselex.lexer.TokenCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One tokenization of one span of a document. Produces tokens lazily: each call to
 * {@link #hasNext()} runs the driver loop only until at least one token is available.
 * <p>
 * A run owns its state stack and string register. A run is single-use and must not be
 * shared between threads.
 */
final class TokenRun implements Iterator<Token>, LexerContext {

    private static final Logger LOG = LoggerFactory.getLogger(TokenRun.class);

    private final Grammar grammar;
    private final String source;
    private final int end;
    private final StateStack stack;
    private final StringRegister strings = new StringRegister();
    private final DiagnosticsEngine diagnostics;
    private final SourcePositions positions;
    private final boolean nested;
    private final Map<Pattern, Matcher> matchers = new IdentityHashMap<>();

    // Tokens and nested runs waiting to be handed out, in document order.
    private final Deque<Iterator<Token>> ready = new ArrayDeque<>();

    private int pos;
    private int emitCursor;
    private int tokenCount = 0;
    private int unrecognized = 0;
    private boolean finished = false;

    TokenRun(Grammar grammar, String source, int start, int end, LexerState startState,
             DiagnosticsEngine diagnostics, SourcePositions positions, boolean nested) {
        this.grammar = grammar;
        this.source = source;
        this.pos = start;
        this.end = end;
        this.stack = new StateStack(startState);
        this.diagnostics = diagnostics;
        this.positions = positions;
        this.nested = nested;
    }

    @Override
    public boolean hasNext() {
        while (true) {
            while (!ready.isEmpty()) {
                if (ready.peekFirst().hasNext()) {
                    return true;
                }
                ready.removeFirst();
            }
            if (pos >= end) {
                finish();
                return false;
            }
            step();
        }
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.peekFirst().next();
    }

    /**
     * Tries the rules of the current state at the current offset and applies the first match.
     * Falls back to a single error character so that every step makes progress.
     */
    private void step() {
        LexerState state = stack.top();
        for (Rule rule : state.rules()) {
            Matcher m = matcherFor(rule.pattern());
            if (!m.lookingAt()) {
                continue;
            }
            int matchEnd = m.end();
            if (matchEnd == pos) {
                // A zero-length match only counts if it moved the stack.
                int depthBefore = stack.depth();
                LexerState topBefore = stack.top();
                apply(rule.action(), m);
                if (stack.depth() != depthBefore || stack.top() != topBefore) {
                    return;
                }
                continue;
            }
            apply(rule.action(), m);
            pos = matchEnd;
            return;
        }
        unrecognizedInput();
    }

    private Matcher matcherFor(Pattern pattern) {
        Matcher m = matchers.computeIfAbsent(pattern, p -> p.matcher(source));
        m.region(pos, end);
        m.useTransparentBounds(true);
        m.useAnchoringBounds(false);
        return m;
    }

    private void apply(RuleAction action, Matcher m) {
        emitCursor = m.start();
        if (action instanceof RuleAction.Emit emit) {
            token(emit.category(), m.group());
        } else if (action instanceof RuleAction.EmitGroups emitGroups) {
            List<TokenCategory> categories = emitGroups.categories();
            for (int i = 0; i < categories.size() && i < m.groupCount(); i++) {
                int groupStart = m.start(i + 1);
                if (groupStart < 0) {
                    continue;
                }
                emitCursor = groupStart;
                token(categories.get(i), m.group(i + 1));
            }
        } else if (action instanceof RuleAction.Computed computed) {
            computed.callback().apply(m, this);
        } else if (action instanceof RuleAction.Recurse) {
            recurse(m.start(), m.end());
        }
        transition(action.transition());
    }

    private void transition(Transition transition) {
        if (transition instanceof Transition.Push push) {
            push(push.state());
        } else if (transition instanceof Transition.Pop) {
            pop();
        } else if (transition instanceof Transition.Goto goTo) {
            goTo(goTo.state());
        }
    }

    private void recurse(int from, int to) {
        if (from == to) {
            return;
        }
        LOG.trace("Recursing into [{}, {}) from state '{}'.", from, to, stack.top().name());
        ready.addLast(new TokenRun(grammar, source, from, to, grammar.recursionState(),
                diagnostics, positions, true));
    }

    private void unrecognizedInput() {
        int width = 1;
        if (Character.isHighSurrogate(source.charAt(pos)) && pos + 1 < end
                && Character.isLowSurrogate(source.charAt(pos + 1))) {
            width = 2;
        }
        if (diagnostics != null) {
            int[] lineColumn = positions.positionOf(pos);
            diagnostics.reportWarning("Unrecognized input '" + source.substring(pos, pos + width)
                    + "' in state '" + stack.top().name() + "'", pos, lineColumn[0], lineColumn[1]);
        }
        unrecognized++;
        emitCursor = pos;
        token(TokenCategory.ERROR, source.substring(pos, pos + width));
        pos += width;
    }

    private void finish() {
        if (finished) {
            return;
        }
        finished = true;
        if (LOG.isDebugEnabled() && !nested) {
            LOG.debug("Tokenization finished: {} tokens, {} unrecognized, final states [{}], open strings {}.",
                    tokenCount, unrecognized, stack, strings.depth());
        }
    }

    // LexerContext

    @Override
    public void token(TokenCategory category, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Token token = new Token(category, text, emitCursor);
        emitCursor += text.length();
        tokenCount++;
        Iterator<Token> last = ready.peekLast();
        if (last instanceof PendingTokens pending) {
            pending.add(token);
        } else {
            PendingTokens pending = new PendingTokens();
            pending.add(token);
            ready.addLast(pending);
        }
    }

    @Override
    public void push(String state) {
        stack.push(grammar.state(state));
    }

    @Override
    public void pop() {
        stack.pop();
    }

    @Override
    public void goTo(String state) {
        stack.replaceTop(grammar.state(state));
    }

    @Override
    public StringRegister strings() {
        return strings;
    }

    private static final class PendingTokens implements Iterator<Token> {
        private final Deque<Token> tokens = new ArrayDeque<>();

        void add(Token token) {
            tokens.addLast(token);
        }

        @Override
        public boolean hasNext() {
            return !tokens.isEmpty();
        }

        @Override
        public Token next() {
            Token token = tokens.pollFirst();
            if (token == null) {
                throw new NoSuchElementException();
            }
            return token;
        }
    }
}
