package org.neuralchilli.acms.worker;

/**
 * A task command could not be started, timed out or exited non-zero.
 */
public class TaskCommandException extends RuntimeException {

    private final int exitCode;

    public TaskCommandException(String message) {
        this(message, -1);
    }

    public TaskCommandException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public TaskCommandException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /**
     * Process exit code, or -1 when the process never exited normally.
     */
    public int exitCode() {
        return exitCode;
    }
}
