package org.fuselex.lexer.engine;

import org.fuselex.diagnostics.Diagnostic;
import org.fuselex.diagnostics.DiagnosticsEngine;
import org.fuselex.lexer.Token;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.fuselex.lexer.TokenCategory.*;

/**
 * Contains unit tests for the {@link RegexLexer} driver, using small grammars that isolate
 * one engine behavior each.
 */
@Tag("unit")
class RegexLexerTest {

    private static final Grammar WORDS = Grammar.builder("root", "root")
            .state("root", s -> s
                    .rule("[a-z]+", NAME)
                    .rule("\\s+", TEXT))
            .build();

    private static List<Token> all(Iterator<Token> tokens) {
        List<Token> list = new ArrayList<>();
        tokens.forEachRemaining(list::add);
        return list;
    }

    /**
     * Verifies that a character no rule matches becomes a single error token
     * and that matching resumes right after it.
     */
    @Test
    void unmatchedCharacterBecomesOneErrorToken() {
        // Act
        List<Token> tokens = all(new RegexLexer(WORDS).tokenize("ab 1 cd"));

        // Assert
        assertThat(tokens)
                .extracting(Token::category, Token::text, Token::offset)
                .containsExactly(
                        tuple(NAME, "ab", 0),
                        tuple(TEXT, " ", 2),
                        tuple(ERROR, "1", 3),
                        tuple(TEXT, " ", 4),
                        tuple(NAME, "cd", 5));
    }

    @Test
    void emptyInputYieldsNoTokens() {
        Iterator<Token> tokens = new RegexLexer(WORDS).tokenize("");

        assertThat(tokens.hasNext()).isFalse();
    }

    @Test
    void surrogatePairIsKeptInOneErrorToken() {
        List<Token> tokens = all(new RegexLexer(WORDS).tokenize("a😀b"));

        assertThat(tokens)
                .extracting(Token::category, Token::text)
                .containsExactly(tuple(NAME, "a"), tuple(ERROR, "😀"), tuple(NAME, "b"));
    }

    /**
     * A zero-length match that leaves the stack untouched must not stall the driver:
     * it is skipped and the next rule gets its turn.
     */
    @Test
    void zeroLengthMatchWithoutTransitionIsSkipped() {
        // Arrange
        Grammar grammar = Grammar.builder("root", "root")
                .state("root", s -> s
                        .move("(?=[a-z])", Transition.NONE)
                        .rule("[a-z]+", NAME))
                .build();

        // Act
        List<Token> tokens = all(new RegexLexer(grammar).tokenize("abc"));

        // Assert
        assertThat(tokens).extracting(Token::category, Token::text).containsExactly(tuple(NAME, "abc"));
    }

    @Test
    void zeroLengthMatchWithTransitionEntersTheState() {
        Grammar grammar = Grammar.builder("root", "root")
                .state("root", s -> s.move("", Transition.push("digits")))
                .state("digits", s -> s.rule("\\d+", NUMBER_INTEGER))
                .build();

        List<Token> tokens = all(new RegexLexer(grammar).tokenize("42x"));

        assertThat(tokens)
                .extracting(Token::category, Token::text)
                .containsExactly(tuple(NUMBER_INTEGER, "42"), tuple(ERROR, "x"));
    }

    @Test
    void poppingTheBottomStateIsIgnored() {
        Grammar grammar = Grammar.builder("root", "root")
                .state("root", s -> s
                        .rule("\\)", PUNCTUATION, Transition.POP)
                        .rule("[a-z]+", NAME))
                .build();

        List<Token> tokens = all(new RegexLexer(grammar).tokenize("))a"));

        assertThat(tokens)
                .extracting(Token::category, Token::text)
                .containsExactly(tuple(PUNCTUATION, ")"), tuple(PUNCTUATION, ")"), tuple(NAME, "a"));
    }

    @Test
    void groupsThatDidNotParticipateEmitNothing() {
        Grammar grammar = Grammar.builder("root", "root")
                .state("root", s -> s.groups("(x\\.)?(y)", NAME_CLASS, NAME_FUNCTION))
                .build();

        List<Token> tokens = all(new RegexLexer(grammar).tokenize("yx.y"));

        assertThat(tokens)
                .extracting(Token::category, Token::text, Token::offset)
                .containsExactly(
                        tuple(NAME_FUNCTION, "y", 0),
                        tuple(NAME_CLASS, "x.", 1),
                        tuple(NAME_FUNCTION, "y", 3));
    }

    /**
     * Verifies that a recursive run starts in the recursion state with its own stack and that
     * its tokens carry document offsets.
     */
    @Test
    void recursionRetokenizesTheMatchFromTheRecursionState() {
        // Arrange
        Grammar grammar = Grammar.builder("outer", "inner")
                .state("outer", s -> s
                        .rule("[a-z]+", KEYWORD)
                        .rule("\\[", PUNCTUATION, Transition.push("brackets")))
                .state("brackets", s -> s
                        .rule("\\]", PUNCTUATION, Transition.POP)
                        .recurse("[^\\]]+"))
                .state("inner", s -> s
                        .rule("[a-z]+", NAME)
                        .rule("\\d+", NUMBER_INTEGER)
                        .rule(" ", TEXT))
                .build();

        // Act
        List<Token> tokens = all(new RegexLexer(grammar).tokenize("x[ab 12]y"));

        // Assert
        assertThat(tokens)
                .extracting(Token::category, Token::text, Token::offset)
                .containsExactly(
                        tuple(KEYWORD, "x", 0),
                        tuple(PUNCTUATION, "[", 1),
                        tuple(NAME, "ab", 2),
                        tuple(TEXT, " ", 4),
                        tuple(NUMBER_INTEGER, "12", 5),
                        tuple(PUNCTUATION, "]", 7),
                        tuple(KEYWORD, "y", 8));
    }

    @Test
    void tokensAreProducedLazily() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();
        Grammar grammar = Grammar.builder("root", "root")
                .state("root", s -> s.rule("[a-z]", (match, context) -> {
                    calls.incrementAndGet();
                    context.token(NAME, match.group());
                }))
                .build();
        String source = "a".repeat(10_000);

        // Act
        Iterator<Token> tokens = new RegexLexer(grammar).tokenize(source);
        Token first = tokens.next();

        // Assert
        assertThat(first.text()).isEqualTo("a");
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void unrecognizedInputIsReportedWithPosition() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("sample.fuse");

        // Act
        List<Token> tokens = all(new RegexLexer(WORDS).tokenize("ab\n c?", diagnostics));

        // Assert
        assertThat(tokens).extracting(Token::category).contains(ERROR);
        assertThat(diagnostics.hasWarnings()).isTrue();
        assertThat(diagnostics.getDiagnostics())
                .extracting(Diagnostic::offset, Diagnostic::line, Diagnostic::column)
                .containsExactly(tuple(5, 2, 3));
        assertThat(diagnostics.summary()).contains("sample.fuse:2:3").contains("'?'");
    }

    @Test
    void fragmentsStartInTheRecursionState() {
        Grammar grammar = Grammar.builder("outer", "inner")
                .state("outer", s -> s.rule("[a-z]+", KEYWORD))
                .state("inner", s -> s.rule("[a-z]+", NAME))
                .build();

        List<Token> tokens = all(new RegexLexer(grammar).tokenizeFragment("abc"));

        assertThat(tokens).extracting(Token::category).containsExactly(NAME);
    }
}
