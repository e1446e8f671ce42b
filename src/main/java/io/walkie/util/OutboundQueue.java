package io.walkie.util;

import java.util.concurrent.LinkedBlockingQueue;

/**
 * Byte chunks waiting for a writer thread, bounded by total queued bytes. A chunk is
 * refused only while earlier chunks are still queued and it would push the total past
 * the limit, so one oversized reply still goes out on an idle connection.
 */
public final class OutboundQueue {
    private static final byte[] CLOSE_SIGNAL = new byte[0];

    private final long maxQueuedBytes;
    private final LinkedBlockingQueue<byte[]> queue;
    private long queuedBytes;

    public OutboundQueue(long maxQueuedBytes) {
        this.maxQueuedBytes = maxQueuedBytes;
        this.queue = new LinkedBlockingQueue<>();
    }

    /** Returns false when the reader has fallen too far behind; the caller should drop the connection. */
    public synchronized boolean offer(byte[] chunk) {
        if (queuedBytes > 0 && queuedBytes + chunk.length > maxQueuedBytes) {
            return false;
        }
        queuedBytes += chunk.length;
        queue.add(chunk);
        return true;
    }

    /** Blocks for the next chunk; null once {@link #close()} has been reached. */
    public byte[] take() throws InterruptedException {
        byte[] next = queue.take();
        if (next == CLOSE_SIGNAL) {
            return null;
        }
        synchronized (this) {
            queuedBytes -= next.length;
        }
        return next;
    }

    /** Lets the writer finish what is already queued, then stop. */
    public void close() {
        queue.add(CLOSE_SIGNAL);
    }

    public synchronized long queuedBytes() {
        return queuedBytes;
    }
}
