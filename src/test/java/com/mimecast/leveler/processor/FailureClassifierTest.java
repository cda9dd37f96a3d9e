package com.mimecast.leveler.processor;

import com.mimecast.leveler.queue.MessageFormatException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class FailureClassifierTest {

    @Test
    void testPermanentFailures() {
        assertTrue(FailureClassifier.isPermanent(new IllegalArgumentException("bad field")));
        assertTrue(FailureClassifier.isPermanent(new NumberFormatException("not a number")));
        assertTrue(FailureClassifier.isPermanent(new UnsupportedOperationException()));
        assertTrue(FailureClassifier.isPermanent(new MessageFormatException("unreadable")));
        assertTrue(FailureClassifier.isPermanent(new PermanentMessageException("rejected")));
    }

    @Test
    void testTransientFailures() {
        assertFalse(FailureClassifier.isPermanent(new IllegalStateException("not ready")));
        assertFalse(FailureClassifier.isPermanent(new IOException("connection reset")));
        assertFalse(FailureClassifier.isPermanent(new RuntimeException(new IllegalArgumentException("wrapped"))));
        assertFalse(FailureClassifier.isPermanent(null));
    }

    @Test
    void testReason() {
        assertEquals("permanent failure: IllegalArgumentException: bad field",
                FailureClassifier.reason(new IllegalArgumentException("bad field")));
        assertEquals("permanent failure: UnsupportedOperationException",
                FailureClassifier.reason(new UnsupportedOperationException()));
    }
}
