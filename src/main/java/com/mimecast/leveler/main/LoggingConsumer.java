package com.mimecast.leveler.main;

import com.mimecast.leveler.processor.MessageConsumer;
import com.mimecast.leveler.queue.QueueMessage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Default consumer for configured queues.
 * <p>Logs each message and completes it.
 */
@SuppressWarnings("rawtypes")
public class LoggingConsumer implements MessageConsumer<Map> {
    private static final Logger log = LogManager.getLogger(LoggingConsumer.class);

    @Override
    public boolean handle(QueueMessage<Map> message) {
        log.info("Message {}: priority={}, deliveryCount={}, label={}, correlationId={}",
                message.getId(), message.getPriority(), message.getDeliveryCount(),
                message.getLabel(), message.getCorrelationId());
        log.debug("Message {} body: {}", message.getId(), message.getBody());
        return true;
    }
}
