package com.testflow.testflow_runner;

/**
 * Base type for every failure the runner raises on purpose. Unchecked, like the
 * rest of the exceptions that cross the engine boundary.
 */
public class TestflowException extends RuntimeException {

    public TestflowException(String message) {
        super(message);
    }

    public TestflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
