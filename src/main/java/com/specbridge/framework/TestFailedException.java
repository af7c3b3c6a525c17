package com.specbridge.framework;

/**
 * Attached to failure events. The message is the plain-text failure detail, one
 * line per failed fragment; the cause is the throwable the body raised, if any.
 * Never thrown by this library.
 */
public class TestFailedException extends RuntimeException {

    public TestFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
