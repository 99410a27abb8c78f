package org.neuralchilli.acms.domain;

/**
 * Thrown when a task graph cannot be constructed: unknown dependency references,
 * duplicate ids, or a missing task collection.
 */
public class GraphValidationException extends RuntimeException {

    public GraphValidationException(String message) {
        super(message);
    }

    public GraphValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
