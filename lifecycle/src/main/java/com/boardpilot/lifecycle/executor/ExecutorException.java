package com.boardpilot.lifecycle.executor;

/**
 * Thrown when the job executor service returns an error, times out or is
 * unreachable.
 */
public class ExecutorException extends RuntimeException {

    public ExecutorException(String message) {
        super(message);
    }

    public ExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}
