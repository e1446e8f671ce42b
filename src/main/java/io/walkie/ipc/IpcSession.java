package io.walkie.ipc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walkie.runtime.ChannelRegistry;
import io.walkie.runtime.EventLoop;
import io.walkie.runtime.LineFramer;
import io.walkie.runtime.PendingRead;
import io.walkie.util.Jsons;
import io.walkie.util.OutboundQueue;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One local control connection. A reader thread feeds raw bytes to the event loop,
 * where they are framed and dispatched; replies go out through a writer thread, so a
 * slow client never stalls the loop.
 */
final class IpcSession implements ClientHandle {
    static final String REQUEST_TOO_LARGE = "Request too large";
    static final long MAX_QUEUED_REPLY_BYTES = 8L * 1024 * 1024;
    private static final int READ_CHUNK_BYTES = 16 * 1024;

    private final SocketChannel socket;
    private final EventLoop loop;
    private final ChannelRegistry channels;
    private final IpcDispatcher dispatcher;
    private final LineFramer framer;
    private final OutboundQueue outbound;
    private final AtomicBoolean open;
    private final List<PendingRead> suspended;
    private final Runnable onClosed;

    IpcSession(
            SocketChannel socket,
            EventLoop loop,
            ChannelRegistry channels,
            IpcDispatcher dispatcher,
            int maxBufferBytes,
            Runnable onClosed
    ) {
        this.socket = socket;
        this.loop = loop;
        this.channels = channels;
        this.dispatcher = dispatcher;
        this.framer = new LineFramer(maxBufferBytes);
        this.outbound = new OutboundQueue(MAX_QUEUED_REPLY_BYTES);
        this.open = new AtomicBoolean(true);
        this.suspended = new ArrayList<>();
        this.onClosed = onClosed;
    }

    @Override
    public void reply(ObjectNode body) {
        if (!open.get()) {
            return;
        }
        if (!outbound.offer((Jsons.toLine(body) + "\n").getBytes(StandardCharsets.UTF_8))) {
            // The client stopped reading; its writer may be stuck, so drop the socket now.
            close();
            closeSocket();
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void track(PendingRead read) {
        suspended.removeIf(PendingRead::isDone);
        suspended.add(read);
    }

    void readLoop() {
        ByteBuffer buf = ByteBuffer.allocate(READ_CHUNK_BYTES);
        try {
            while (open.get()) {
                buf.clear();
                int n = socket.read(buf);
                if (n < 0) {
                    break;
                }
                if (n > 0) {
                    byte[] chunk = Arrays.copyOf(buf.array(), n);
                    loop.execute(() -> onData(chunk));
                }
            }
        } catch (IOException e) {
            // Client went away mid-read; handled as a close below.
        } finally {
            close();
        }
    }

    void writeLoop() {
        try {
            while (true) {
                byte[] next = outbound.take();
                if (next == null) {
                    break;
                }
                ByteBuffer buf = ByteBuffer.wrap(next);
                while (buf.hasRemaining()) {
                    socket.write(buf);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            // Client stopped reading; nothing left to deliver.
        } finally {
            close();
            closeSocket();
        }
    }

    private void closeSocket() {
        try {
            socket.close();
        } catch (IOException ignored) {
            // Already closed by the peer.
        }
    }

    void onData(byte[] chunk) {
        if (!open.get()) {
            return;
        }
        List<String> records;
        try {
            records = framer.append(chunk);
        } catch (LineFramer.FrameOverflowException e) {
            reply(IpcDispatcher.error(REQUEST_TOO_LARGE));
            close();
            return;
        }
        for (String record : records) {
            JsonNode request;
            try {
                request = Jsons.mapper().readTree(record);
            } catch (JsonProcessingException e) {
                reply(IpcDispatcher.error("Invalid JSON: " + e.getOriginalMessage()));
                continue;
            }
            dispatcher.dispatch(request, this);
        }
    }

    /** Flushes queued replies, then closes the socket. */
    void close() {
        if (!open.compareAndSet(true, false)) {
            return;
        }
        outbound.close();
        loop.execute(this::withdrawReads);
        onClosed.run();
    }

    private void withdrawReads() {
        for (PendingRead read : suspended) {
            if (!read.isDone()) {
                channels.cancel(read);
            }
        }
        suspended.clear();
    }
}
