package org.fuselex.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the warnings that occur while a document is tokenized.
 * <p>
 * This decouples reporting from the lexer: the token stream is the same whether or not
 * an engine is attached, and callers decide what a finding means for them.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final String sourceName;

    /**
     * Creates an engine for an anonymous, in-memory document.
     */
    public DiagnosticsEngine() {
        this("<memory>");
    }

    /**
     * Creates an engine for a named document.
     * @param sourceName The logical name used in reported diagnostics.
     */
    public DiagnosticsEngine(String sourceName) {
        this.sourceName = sourceName;
    }

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param offset  The character offset of the warning.
     * @param line    The 1-based line number.
     * @param column  The 1-based column number.
     */
    public void reportWarning(String message, int offset, int line, int column) {
        diagnostics.add(new Diagnostic(message, sourceName, offset, line, column));
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
