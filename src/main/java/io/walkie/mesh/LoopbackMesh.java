package io.walkie.mesh;

import io.walkie.model.Topic;
import io.walkie.util.Hashing;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * In-process mesh. Every node registered on the same {@link Hub} is connected to
 * every other node it shares a topic with, at most once per pair. Used by tests and
 * by the self-test command.
 */
public final class LoopbackMesh implements MeshSubstrate {
    private final Hub hub;
    private final String identity;
    private final Set<Topic> topics;
    private final Map<String, LoopbackConnection> connections;
    private volatile Consumer<MeshConnection> connectionHandler;
    private boolean closed;

    public LoopbackMesh(Hub hub) {
        this(hub, Hashing.sha256Hex(UUID.randomUUID().toString().getBytes(StandardCharsets.UTF_8)));
    }

    public LoopbackMesh(Hub hub, String identity) {
        this.hub = hub;
        this.identity = identity;
        this.topics = new HashSet<>();
        this.connections = new LinkedHashMap<>();
        hub.register(this);
    }

    public String identity() {
        return identity;
    }

    @Override
    public void onConnection(Consumer<MeshConnection> handler) {
        this.connectionHandler = handler;
    }

    @Override
    public DiscoveryHandle join(Topic topic) {
        List<LoopbackConnection> opened = hub.topicJoined(this, topic);
        for (LoopbackConnection conn : opened) {
            conn.owner.announce(conn);
        }
        return new DiscoveryHandle() {
            @Override
            public CompletableFuture<Void> flushed() {
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public CompletableFuture<Void> destroy() {
                hub.topicLeft(LoopbackMesh.this, topic);
                return CompletableFuture.completedFuture(null);
            }
        };
    }

    public int connectionCount() {
        synchronized (hub) {
            return connections.size();
        }
    }

    /** Drops the link to {@code remoteIdentity} from this side, as a network failure would. */
    public void disconnect(String remoteIdentity) {
        LoopbackConnection conn;
        synchronized (hub) {
            conn = connections.get(remoteIdentity);
        }
        if (conn != null) {
            conn.close();
        }
    }

    @Override
    public void close() {
        List<LoopbackConnection> open;
        synchronized (hub) {
            if (closed) {
                return;
            }
            closed = true;
            topics.clear();
            open = new ArrayList<>(connections.values());
            hub.nodes.remove(identity);
        }
        for (LoopbackConnection conn : open) {
            conn.close();
        }
    }

    private void announce(LoopbackConnection conn) {
        Consumer<MeshConnection> handler = connectionHandler;
        if (handler != null) {
            handler.accept(conn);
        }
    }

    public static final class Hub {
        private final Map<String, LoopbackMesh> nodes = new LinkedHashMap<>();

        synchronized void register(LoopbackMesh node) {
            if (nodes.putIfAbsent(node.identity, node) != null) {
                throw new IllegalArgumentException("Duplicate loopback identity: " + node.identity);
            }
        }

        synchronized List<LoopbackConnection> topicJoined(LoopbackMesh node, Topic topic) {
            if (node.closed) {
                throw new IllegalStateException("Loopback mesh closed");
            }
            node.topics.add(topic);
            List<LoopbackConnection> opened = new ArrayList<>();
            for (LoopbackMesh other : nodes.values()) {
                if (other == node || !other.topics.contains(topic) || node.connections.containsKey(other.identity)) {
                    continue;
                }
                LoopbackConnection local = new LoopbackConnection(this, node, other.identity);
                LoopbackConnection remote = new LoopbackConnection(this, other, node.identity);
                local.partner = remote;
                remote.partner = local;
                node.connections.put(other.identity, local);
                other.connections.put(node.identity, remote);
                opened.add(local);
                opened.add(remote);
            }
            return opened;
        }

        synchronized void topicLeft(LoopbackMesh node, Topic topic) {
            node.topics.remove(topic);
        }

        synchronized void unlink(LoopbackConnection conn) {
            conn.owner.connections.remove(conn.remoteIdentity, conn);
        }
    }

    static final class LoopbackConnection implements MeshConnection {
        private final Hub hub;
        private final LoopbackMesh owner;
        private final String remoteIdentity;
        private final List<byte[]> pending;
        private LoopbackConnection partner;
        private StreamHandler handler;
        private boolean closed;
        private boolean closeDelivered;

        LoopbackConnection(Hub hub, LoopbackMesh owner, String remoteIdentity) {
            this.hub = hub;
            this.owner = owner;
            this.remoteIdentity = remoteIdentity;
            this.pending = new ArrayList<>();
        }

        @Override
        public String remoteIdentity() {
            return remoteIdentity;
        }

        @Override
        public synchronized void setHandler(StreamHandler handler) {
            this.handler = handler;
            for (byte[] chunk : pending) {
                handler.onData(chunk);
            }
            pending.clear();
            if (closed && !closeDelivered) {
                closeDelivered = true;
                handler.onClose();
            }
        }

        @Override
        public synchronized boolean isWritable() {
            return !closed;
        }

        @Override
        public void write(byte[] bytes) {
            if (!isWritable()) {
                return;
            }
            partner.deliver(bytes.clone());
        }

        @Override
        public void close() {
            hub.unlink(this);
            hub.unlink(partner);
            markClosed();
            partner.markClosed();
        }

        private synchronized void deliver(byte[] chunk) {
            if (closed) {
                return;
            }
            if (handler == null) {
                pending.add(chunk);
            } else {
                handler.onData(chunk);
            }
        }

        private synchronized void markClosed() {
            if (closed) {
                return;
            }
            closed = true;
            if (handler != null) {
                closeDelivered = true;
                handler.onClose();
            }
        }
    }
}
