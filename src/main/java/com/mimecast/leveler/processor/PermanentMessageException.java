package com.mimecast.leveler.processor;

/**
 * Thrown by consumers for messages that can never be processed.
 * <p>The message is dead-lettered immediately.
 */
public class PermanentMessageException extends RuntimeException {

    /**
     * Constructs a new PermanentMessageException instance.
     *
     * @param message Error message.
     */
    public PermanentMessageException(String message) {
        super(message);
    }

    /**
     * Constructs a new PermanentMessageException instance.
     *
     * @param message Error message.
     * @param cause   Cause.
     */
    public PermanentMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}
