package org.greymatter.engram;

/**
 * Base exception for memory engine operations.
 *
 * <p>All engram exceptions extend this class,
 * making it easy to catch all engine-related errors.</p>
 */
public class EngramException extends RuntimeException {

    /**
     * Create a new exception with a message.
     *
     * @param message error message
     */
    public EngramException(String message) {
        super(message);
    }

    /**
     * Create a new exception with a message and cause.
     *
     * @param message error message
     * @param cause underlying cause
     */
    public EngramException(String message, Throwable cause) {
        super(message, cause);
    }
}
