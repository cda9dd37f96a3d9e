package com.mimecast.leveler.queue;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MessagePriorityTest {

    @Test
    void testReceiveOrder() {
        assertEquals(List.of(MessagePriority.CRITICAL, MessagePriority.HIGH, MessagePriority.NORMAL, MessagePriority.LOW),
                MessagePriority.RECEIVE_ORDER);
    }

    @Test
    void testKeys() {
        QueueKeys keys = new QueueKeys("orders");

        assertEquals("orders", keys.priority(MessagePriority.NORMAL));
        assertEquals("orders:critical", keys.priority(MessagePriority.CRITICAL));
        assertEquals("orders:high", keys.priority(MessagePriority.HIGH));
        assertEquals("orders:low", keys.priority(MessagePriority.LOW));
        assertEquals("orders:processing", keys.processing());
        assertEquals("orders:delayed", keys.delayed());
        assertEquals("orders:deadletter", keys.deadLetter());
        assertEquals("orders:stats", keys.stats());
        assertEquals(8, keys.all().length);
    }

    @Test
    void testFromStringDefaultsToNormal() {
        assertEquals(MessagePriority.HIGH, MessagePriority.fromString("high"));
        assertEquals(MessagePriority.NORMAL, MessagePriority.fromString(null));
        assertEquals(MessagePriority.NORMAL, MessagePriority.fromString("urgent"));
    }
}
