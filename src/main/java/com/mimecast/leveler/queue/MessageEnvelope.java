package com.mimecast.leveler.queue;

import java.util.HashMap;
import java.util.Map;

/**
 * Store representation of a message.
 * <p>Serialized to JSON with Gson. Times are epoch milliseconds and the body is kept as serialized text
 * so the envelope can be read without knowing the body type.
 */
class MessageEnvelope {

    String id;
    String body;
    String contentType;
    long enqueuedTime;
    Long dequeueTime;
    int deliveryCount;
    String priority;
    String correlationId;
    String replyTo;
    String label;
    Long timeToLive;
    Long expiresAt;
    Map<String, String> properties = new HashMap<>();
}
