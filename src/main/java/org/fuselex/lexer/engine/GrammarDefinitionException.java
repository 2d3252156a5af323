package org.fuselex.lexer.engine;

/**
 * Thrown when a grammar is assembled from an inconsistent rule table,
 * e.g. a rule pushes a state that was never defined or mixins form a cycle.
 */
public class GrammarDefinitionException extends RuntimeException {

    /**
     * Constructs a new exception with the specified detail message.
     * @param message The detail message.
     */
    public GrammarDefinitionException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public GrammarDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
