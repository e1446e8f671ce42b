package io.walkie.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboundQueueTest {

    @Test
    void acceptsChunksWithinBudget() {
        OutboundQueue queue = new OutboundQueue(10);
        assertTrue(queue.offer(new byte[4]));
        assertTrue(queue.offer(new byte[6]));
        assertEquals(10L, queue.queuedBytes());
    }

    @Test
    void refusesChunkThatWouldOverflowBacklog() {
        OutboundQueue queue = new OutboundQueue(10);
        assertTrue(queue.offer(new byte[8]));
        assertFalse(queue.offer(new byte[3]));
        assertEquals(8L, queue.queuedBytes());
    }

    @Test
    void oversizedChunkGoesThroughWhenNothingIsQueued() {
        OutboundQueue queue = new OutboundQueue(10);
        assertTrue(queue.offer(new byte[64]));
        assertFalse(queue.offer(new byte[1]));
    }

    @Test
    void takingFreesBudget() throws Exception {
        OutboundQueue queue = new OutboundQueue(10);
        queue.offer(new byte[]{1, 2, 3, 4, 5, 6, 7, 8});

        assertArrayEquals(new byte[]{1, 2, 3, 4, 5, 6, 7, 8}, queue.take());
        assertEquals(0L, queue.queuedBytes());
        assertTrue(queue.offer(new byte[10]));
    }

    @Test
    void closeDrainsQueuedChunksThenSignalsEnd() throws Exception {
        OutboundQueue queue = new OutboundQueue(10);
        queue.offer(new byte[]{7});
        queue.close();

        assertArrayEquals(new byte[]{7}, queue.take());
        assertNull(queue.take());
    }

    @Test
    void emptyChunkIsNotMistakenForClose() throws Exception {
        OutboundQueue queue = new OutboundQueue(10);
        queue.offer(new byte[0]);
        assertArrayEquals(new byte[0], queue.take());
    }
}
