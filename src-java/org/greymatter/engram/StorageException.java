package org.greymatter.engram;

/**
 * Thrown when persisted state exists but cannot be read or written.
 *
 * <p>A store that is simply absent is not an error: loaders report that case
 * with an empty {@link java.util.Optional} and the engine starts cold.</p>
 */
public class StorageException extends EngramException {

    /**
     * @param message error message
     */
    public StorageException(String message) {
        super(message);
    }

    /**
     * @param message error message
     * @param cause underlying I/O failure
     */
    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
