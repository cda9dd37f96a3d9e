package com.mimecast.leveler.queue;

/**
 * Message body serializer.
 */
public interface MessageSerializer {

    /**
     * Serialize a body.
     *
     * @param body Body.
     * @return Serialized text.
     * @throws MessageFormatException If the body cannot be serialized.
     */
    String serialize(Object body);

    /**
     * Deserialize a body.
     *
     * @param data Serialized text.
     * @param type Body type.
     * @param <T>  Body type.
     * @return Body.
     * @throws MessageFormatException If the text is not a valid body of the given type.
     */
    <T> T deserialize(String data, Class<T> type);

    /**
     * Gets the content type recorded with serialized bodies.
     *
     * @return Content type.
     */
    String getContentType();
}
