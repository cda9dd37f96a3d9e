package com.mimecast.leveler.queue;

/**
 * Thrown when a message body or envelope cannot be serialized or deserialized.
 * <p>Treated as a permanent failure: such messages are dead-lettered without retry.
 */
public class MessageFormatException extends RuntimeException {

    /**
     * Constructs a new MessageFormatException instance.
     *
     * @param message Error message.
     * @param cause   Cause.
     */
    public MessageFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new MessageFormatException instance.
     *
     * @param message Error message.
     */
    public MessageFormatException(String message) {
        super(message);
    }
}
