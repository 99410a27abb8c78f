package org.neuralchilli.acms.core;

/**
 * Thrown when a state machine is asked to move outside its transition table,
 * including a retry past the attempt budget. This is a contract violation and is
 * never retried.
 */
public class IllegalTransitionException extends RuntimeException {

    private final Object from;
    private final Object to;

    public IllegalTransitionException(Object from, Object to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public IllegalTransitionException(Object from, Object to) {
        this(from, to, from + " -> " + to + " not allowed");
    }

    public Object from() {
        return from;
    }

    public Object to() {
        return to;
    }
}
