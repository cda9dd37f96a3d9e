package com.mimecast.leveler.store;

/**
 * Thrown when the backing store cannot be reached or rejects an operation.
 */
public class StoreUnavailableException extends RuntimeException {

    /**
     * Constructs a new StoreUnavailableException instance.
     *
     * @param message Error message.
     * @param cause   Underlying exception.
     */
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new StoreUnavailableException instance.
     *
     * @param message Error message.
     */
    public StoreUnavailableException(String message) {
        super(message);
    }
}
