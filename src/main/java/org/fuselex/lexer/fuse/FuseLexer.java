package org.fuselex.lexer.fuse;

import org.fuselex.diagnostics.DiagnosticsEngine;
import org.fuselex.lexer.Token;
import org.fuselex.lexer.TokenStreams;
import org.fuselex.lexer.engine.Grammar;
import org.fuselex.lexer.engine.RegexLexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * The lexer for Fuse source files.
 * <p>
 * {@link #tokenize(String)} yields one token per rule emission, exactly as the grammar produces
 * them. {@link #lex(String)} merges adjacent tokens of the same category, which is the form a
 * highlighter wants. Both cover the input losslessly and never fail.
 * <p>
 * Instances are immutable and may be shared between threads.
 */
public class FuseLexer {

    /** Display name, tag, file globs and MIME types of this lexer. */
    public static final LexerDescriptor DESCRIPTOR = new LexerDescriptor(
            "Fuse",
            "Fuse (https://fuse-lang.github.io)",
            "fuse",
            List.of("*.fuse", "*.fu"),
            List.of("text/x-fuse", "application/x-fuse"));

    // #!/usr/bin/fuse, #!/usr/bin/env fuse, #! fuse --flag
    private static final Pattern SHEBANG = Pattern.compile("\\A#!\\s*(?:\\S*/)?(?:env\\s+)?fuse(?=\\s|\\z)");

    private static final Grammar DEFAULT_GRAMMAR = FuseGrammar.create(FuseLexerOptions.DEFAULTS);

    private final FuseLexerOptions options;
    private final RegexLexer lexer;

    /**
     * Creates a lexer with the default options.
     */
    public FuseLexer() {
        this(FuseLexerOptions.DEFAULTS);
    }

    /**
     * Creates a lexer.
     * @param options The options controlling built-in name classification.
     */
    public FuseLexer(FuseLexerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        Grammar grammar = FuseLexerOptions.DEFAULTS.equals(options) ? DEFAULT_GRAMMAR : FuseGrammar.create(options);
        this.lexer = new RegexLexer(grammar);
    }

    /**
     * Decides from the content whether a document is Fuse source.
     * @param sample The beginning of the document.
     * @return {@code true} if the first line is a shebang naming {@code fuse}.
     */
    public static boolean detect(String sample) {
        return sample != null && SHEBANG.matcher(sample).find();
    }

    public FuseLexerOptions options() {
        return options;
    }

    /**
     * Tokenizes a document, one token per rule emission.
     * @param source The document.
     * @return A lazy, single-use iterator.
     */
    public Iterator<Token> tokenize(String source) {
        return lexer.tokenize(source);
    }

    /**
     * Tokenizes a document and reports unrecognized input.
     * @param source The document.
     * @param diagnostics Receives a warning per unrecognized character.
     * @return A lazy, single-use iterator.
     */
    public Iterator<Token> tokenize(String source, DiagnosticsEngine diagnostics) {
        return lexer.tokenize(source, diagnostics);
    }

    /**
     * Tokenizes a document with adjacent same-category tokens merged.
     * @param source The document.
     * @return A lazy, single-use iterator.
     */
    public Iterator<Token> lex(String source) {
        return TokenStreams.coalesce(lexer.tokenize(source));
    }

    /**
     * Same as {@link #lex(String)}, as a stream.
     * @param source The document.
     * @return A lazy stream.
     */
    public Stream<Token> stream(String source) {
        return TokenStreams.stream(lex(source));
    }

    /**
     * Tokenizes a document eagerly, one token per rule emission.
     * @param source The document.
     * @return All tokens.
     */
    public List<Token> tokens(String source) {
        List<Token> tokens = new ArrayList<>();
        tokenize(source).forEachRemaining(tokens::add);
        return tokens;
    }
}
