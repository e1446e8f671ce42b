package io.walkie.runtime;

import io.walkie.config.DaemonSettings;
import io.walkie.mesh.MeshConnection;
import io.walkie.mesh.MeshSubstrate;
import io.walkie.mesh.StreamHandler;
import io.walkie.model.MessageEntry;
import io.walkie.observability.DaemonLog;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One daemon instance: the event loop plus the channel and peer registries and the
 * router between them. Several instances can share a JVM, which is how the tests run
 * two daemons against each other.
 *
 * <p>The accessor methods {@link #channels()}, {@link #peers()} and {@link #router()}
 * hand out loop-confined objects; call them from loop tasks only. The other public
 * methods may be called from any thread.
 */
public final class WalkieDaemon implements AutoCloseable {
    private static final long SHUTDOWN_WAIT_MS = 5_000L;

    private final String instanceId;
    private final DaemonSettings settings;
    private final MeshSubstrate mesh;
    private final DaemonLog log;
    private final EventLoop loop;
    private final ChannelRegistry channels;
    private final MessageRouter router;
    private final PeerRegistry peers;
    private final AtomicBoolean started;
    private final AtomicBoolean closed;

    public WalkieDaemon(String instanceId, DaemonSettings settings, MeshSubstrate mesh, DaemonLog log) {
        this(instanceId, settings, mesh, log, Clock.systemUTC());
    }

    public WalkieDaemon(String instanceId, DaemonSettings settings, MeshSubstrate mesh, DaemonLog log, Clock clock) {
        this.instanceId = instanceId;
        this.settings = settings;
        this.mesh = mesh;
        this.log = log;
        this.loop = new EventLoop("walkie-loop-" + instanceId);
        this.channels = new ChannelRegistry(loop, mesh, log);
        this.router = new MessageRouter(channels, instanceId, clock, log);
        this.peers = new PeerRegistry(
                channels,
                router,
                instanceId,
                settings.maxPeerBufferBytes(),
                settings.maxMessageBytes(),
                log
        );
        this.router.attach(peers);
        this.channels.setListener(peers);
        this.started = new AtomicBoolean(false);
        this.closed = new AtomicBoolean(false);
    }

    /** Starts taking mesh connections. */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        mesh.onConnection(this::acceptConnection);
        log.log("daemon.start", Map.of("instance", instanceId));
    }

    private void acceptConnection(MeshConnection connection) {
        // Queue the peer before attaching the handler, which may replay buffered data at once.
        loop.execute(() -> peers.onConnection(connection));
        connection.setHandler(new StreamHandler() {
            @Override
            public void onData(byte[] chunk) {
                loop.execute(() -> peers.onData(connection, chunk));
            }

            @Override
            public void onClose() {
                loop.execute(() -> peers.onClose(connection));
            }
        });
    }

    public String instanceId() {
        return instanceId;
    }

    public DaemonSettings settings() {
        return settings;
    }

    public DaemonLog log() {
        return log;
    }

    public EventLoop loop() {
        return loop;
    }

    public ChannelRegistry channels() {
        return channels;
    }

    public PeerRegistry peers() {
        return peers;
    }

    public MessageRouter router() {
        return router;
    }

    public CompletableFuture<Void> join(String channel, String secret) {
        return loop.submit(() -> channels.join(channel, secret))
                .thenCompose(future -> future)
                .thenApply(ignored -> null);
    }

    public CompletableFuture<Integer> send(String channel, String message) {
        return loop.submit(() -> router.send(channel, message));
    }

    public CompletableFuture<List<MessageEntry>> read(String channel, boolean wait, Duration timeout) {
        return loop.submit(() -> channels.read(channel, wait, timeout, () -> true))
                .thenCompose(PendingRead::result);
    }

    public CompletableFuture<Void> leave(String channel) {
        return loop.submit(() -> channels.leave(channel)).thenCompose(future -> future);
    }

    public CompletableFuture<Map<String, ChannelRegistry.ChannelStatus>> status() {
        return loop.submit(channels::status);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** Releases every topic, closes every peer and stops the loop. Later calls do nothing. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (loop.inLoop()) {
            releaseAll();
        } else {
            try {
                loop.submit(() -> {
                    releaseAll();
                    return null;
                }).get(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException | TimeoutException e) {
                log.log("daemon.stop_incomplete", Map.of("error", String.valueOf(e.getMessage())));
            }
        }
        mesh.close();
        log.log("daemon.stop", Map.of("instance", instanceId));
        loop.close();
    }

    private void releaseAll() {
        channels.closeAll();
        peers.closeAll();
    }
}
