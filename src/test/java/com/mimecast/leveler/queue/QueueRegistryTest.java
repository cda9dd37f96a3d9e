package com.mimecast.leveler.queue;

import com.mimecast.leveler.MutableClock;
import com.mimecast.leveler.config.QueueConfig;
import com.mimecast.leveler.store.InMemoryQueueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueueRegistryTest {

    private InMemoryQueueStore store;
    private QueueRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryQueueStore();
        registry = new QueueRegistry(store, new QueueConfig(new HashMap<>()), new GsonMessageSerializer(), new MutableClock());
    }

    @Test
    void testGetQueueReturnsSameInstance() {
        MessageQueue<String> first = registry.getQueue("events", String.class);
        MessageQueue<String> second = registry.getQueue("events", String.class);

        assertSame(first, second);
        assertEquals("events", first.getName());
        assertSame(first, registry.findQueue("events"));
        assertNull(registry.findQueue("missing"));
    }

    @Test
    void testBodyTypeMismatch() {
        registry.getQueue("events", String.class);

        assertThrows(IllegalArgumentException.class, () -> registry.getQueue("events", Map.class));
    }

    @Test
    void testBlankNameRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.getQueue(" ", String.class));
    }

    @Test
    void testQueueNamesAreSorted() {
        registry.getQueue("zeta", String.class);
        registry.getQueue("alpha", String.class);

        assertEquals(List.of("alpha", "zeta"), registry.getQueueNames());
        assertEquals(2, registry.getQueues().size());
        assertSame(store, registry.getStore());
    }

    @Test
    void testQueueUsesConfiguredDeliveryLimit() {
        Map<String, Object> map = new HashMap<>();
        map.put("maxDeliveryCount", 1.0);
        QueueRegistry strict = new QueueRegistry(store, new QueueConfig(map), new GsonMessageSerializer(), new MutableClock());
        MessageQueue<String> queue = strict.getQueue("strict", String.class);

        queue.send("payload");
        assertTrue(queue.abandon(queue.receive(1, Duration.ofMinutes(1)).get(0)));

        assertEquals(1, queue.getStatistics().getDeadLetterCount());
    }

    @Test
    void testPublisher() {
        MessagePublisher publisher = new MessagePublisher(registry);

        String id = publisher.publish("events", String.class, "one");
        publisher.publish("events", String.class, "two", new QueueOptions().setPriority(MessagePriority.HIGH));
        List<String> ids = publisher.publishBatch("events", String.class, List.of("three", "four"), null);

        assertNotNull(id);
        assertEquals(2, ids.size());

        MessageQueue<String> queue = registry.getQueue("events", String.class);
        List<QueueMessage<String>> received = queue.receive(10, Duration.ofMinutes(1));
        assertEquals(4, received.size());
        assertEquals("two", received.get(0).getBody());
        assertEquals("one", received.get(1).getBody());
    }
}
