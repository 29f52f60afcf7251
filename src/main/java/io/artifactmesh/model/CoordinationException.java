package io.artifactmesh.model;

/**
 * Base for the coordination error taxonomy. Fatal errors need an operator; recoverable ones are
 * retried on the next lifecycle trigger.
 */
public abstract class CoordinationException extends RuntimeException {
    protected CoordinationException(String message) {
        super(message);
    }

    protected CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean fatal();
}
