package io.walkie.mesh;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.walkie.model.Topic;
import io.walkie.observability.DaemonLog;
import io.walkie.util.Hashing;
import io.walkie.util.Jsons;
import io.walkie.util.OutboundQueue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * LAN mesh over UDP announcements and TCP streams.
 *
 * <p>Every announce interval the node sends {@code {"id","port","keys"}} to each seed,
 * where {@code keys} are SHA-256 digests of the joined topics, so topics themselves
 * never appear in discovery traffic. A node that hears a shared key from a node with a
 * greater identity dials it. At most one connection is kept per remote identity.
 *
 * <p>Each new stream opens with a handshake in which both ends send their identity and
 * a fresh nonce, then the dialer names a discovery key and proves it holds the topic
 * behind it with an HMAC-SHA256 keyed by the topic over the acceptor's nonce. The
 * acceptor checks the proof against its own joined topics and answers with its own
 * proof over the dialer's nonce. A stream is handed to the daemon only after both
 * proofs check out, so a caller without a shared secret never sees a hello.
 *
 * <p>Streams are not encrypted.
 */
public final class LanMesh implements MeshSubstrate {
    private static final int IDENTITY_BYTES = 32;
    private static final int HANDSHAKE_LINE_MAX_BYTES = 512;
    private static final int HANDSHAKE_TIMEOUT_MS = 5_000;
    private static final int NONCE_BYTES = 16;
    static final int DATAGRAM_MAX_BYTES = 8192;
    static final int KEYS_PER_ANNOUNCEMENT = 64;
    static final long MAX_QUEUED_WRITE_BYTES = 8L * 1024 * 1024;
    private static final int READ_CHUNK_BYTES = 16 * 1024;
    private static final Pattern IDENTITY_HEX = Pattern.compile("[0-9a-f]{" + (IDENTITY_BYTES * 2) + "}");
    private static final SecureRandom RANDOM = new SecureRandom();

    private final String identity;
    private final int meshPort;
    private final int discoveryPort;
    private final long announceIntervalMs;
    private final List<SeedEndpoint> seeds;
    private final DaemonLog log;
    private final Map<Topic, List<CompletableFuture<Void>>> topics;
    private final Map<String, TcpConnection> connections;
    private final Set<String> dialing;
    private final AtomicBoolean closed;
    private final ScheduledExecutorService announcer;
    private final ExecutorService workers;
    private volatile Consumer<MeshConnection> connectionHandler;
    private ServerSocket serverSocket;
    private DatagramSocket discoverySocket;

    public LanMesh(int meshPort, int discoveryPort, long announceIntervalMs, List<String> seeds, DaemonLog log) {
        byte[] raw = new byte[IDENTITY_BYTES];
        RANDOM.nextBytes(raw);
        this.identity = HexFormat.of().formatHex(raw);
        this.meshPort = meshPort;
        this.discoveryPort = discoveryPort;
        this.announceIntervalMs = announceIntervalMs;
        this.seeds = SeedEndpoint.parseAll(seeds);
        this.log = log;
        this.topics = new LinkedHashMap<>();
        this.connections = new ConcurrentHashMap<>();
        this.dialing = ConcurrentHashMap.newKeySet();
        this.closed = new AtomicBoolean(false);
        this.announcer = Executors.newSingleThreadScheduledExecutor(r -> daemonThread(r, "walkie-lan-announce"));
        this.workers = Executors.newCachedThreadPool(r -> daemonThread(r, "walkie-lan-io"));
    }

    public String identity() {
        return identity;
    }

    /** Binds the TCP and UDP sockets and starts announcing. */
    public void start() throws IOException {
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(meshPort));
        discoverySocket = new DatagramSocket(null);
        discoverySocket.setReuseAddress(true);
        discoverySocket.setBroadcast(true);
        discoverySocket.bind(new InetSocketAddress(discoveryPort));
        workers.execute(this::acceptLoop);
        workers.execute(this::receiveLoop);
        announcer.scheduleAtFixedRate(this::announce, 0L, announceIntervalMs, TimeUnit.MILLISECONDS);
        log.log("mesh.lan.start", Map.of(
                "identity", identity.substring(0, 8),
                "mesh_port", meshPort,
                "discovery_port", discoveryPort,
                "seeds", seeds.size()
        ));
    }

    @Override
    public void onConnection(Consumer<MeshConnection> handler) {
        this.connectionHandler = handler;
    }

    @Override
    public DiscoveryHandle join(Topic topic) {
        CompletableFuture<Void> flushed = new CompletableFuture<>();
        synchronized (topics) {
            topics.computeIfAbsent(topic, t -> new ArrayList<>()).add(flushed);
        }
        if (closed.get()) {
            flushed.completeExceptionally(new IllegalStateException("LAN mesh closed"));
        }
        return new DiscoveryHandle() {
            @Override
            public CompletableFuture<Void> flushed() {
                return flushed;
            }

            @Override
            public CompletableFuture<Void> destroy() {
                synchronized (topics) {
                    topics.remove(topic);
                }
                return CompletableFuture.completedFuture(null);
            }
        };
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (topics) {
            topics.clear();
        }
        announcer.shutdownNow();
        closeQuietly(serverSocket);
        if (discoverySocket != null) {
            discoverySocket.close();
        }
        for (TcpConnection conn : new ArrayList<>(connections.values())) {
            conn.close();
        }
        workers.shutdownNow();
        log.log("mesh.lan.stop");
    }

    private void announce() {
        List<String> keys = new ArrayList<>();
        List<CompletableFuture<Void>> toFlush = new ArrayList<>();
        synchronized (topics) {
            for (Map.Entry<Topic, List<CompletableFuture<Void>>> entry : topics.entrySet()) {
                keys.add(discoveryKey(entry.getKey()));
                toFlush.addAll(entry.getValue());
                entry.getValue().clear();
            }
        }
        if (keys.isEmpty()) {
            return;
        }
        List<byte[]> packets = announcementPackets(identity, meshPort, keys);
        for (SeedEndpoint seed : seeds) {
            try {
                InetAddress address = InetAddress.getByName(seed.host());
                for (byte[] payload : packets) {
                    discoverySocket.send(new DatagramPacket(payload, payload.length, address, seed.port()));
                }
            } catch (IOException e) {
                log.log("mesh.lan.announce_failed", Map.of("seed", seed.host() + ":" + seed.port(), "error", String.valueOf(e.getMessage())));
            }
        }
        for (CompletableFuture<Void> future : toFlush) {
            future.complete(null);
        }
    }

    private void receiveLoop() {
        while (!closed.get()) {
            byte[] buf = new byte[DATAGRAM_MAX_BYTES];
            DatagramPacket incoming = new DatagramPacket(buf, buf.length);
            try {
                discoverySocket.receive(incoming);
            } catch (IOException e) {
                if (!closed.get()) {
                    log.log("mesh.lan.receive_failed", Map.of("error", String.valueOf(e.getMessage())));
                }
                return;
            }
            String body = new String(incoming.getData(), incoming.getOffset(), incoming.getLength(), StandardCharsets.UTF_8);
            Announcement announcement;
            try {
                announcement = Jsons.mapper().readValue(body, Announcement.class);
            } catch (IOException e) {
                log.log("mesh.lan.announcement_dropped", Map.of(
                        "from", String.valueOf(incoming.getAddress()),
                        "bytes", incoming.getLength()
                ));
                continue;
            }
            onAnnouncement(announcement, incoming.getAddress());
        }
    }

    private void onAnnouncement(Announcement announcement, InetAddress from) {
        String remote = announcement.id();
        if (remote == null || remote.isBlank() || remote.equals(identity) || announcement.keys() == null) {
            return;
        }
        // The smaller identity dials so that two nodes never open crossing connections.
        if (identity.compareTo(remote) > 0 || connections.containsKey(remote)) {
            return;
        }
        if (announcement.port() <= 0 || announcement.port() > 65535) {
            return;
        }
        String sharedKey = sharedKey(announcement.keys());
        if (sharedKey == null || !dialing.add(remote)) {
            return;
        }
        workers.execute(() -> {
            try {
                dial(remote, new InetSocketAddress(from, announcement.port()), sharedKey);
            } finally {
                dialing.remove(remote);
            }
        });
    }

    private String sharedKey(List<String> keys) {
        synchronized (topics) {
            for (Topic topic : topics.keySet()) {
                String key = discoveryKey(topic);
                if (keys.contains(key)) {
                    return key;
                }
            }
        }
        return null;
    }

    private Topic topicForKey(String key) {
        if (key == null) {
            return null;
        }
        synchronized (topics) {
            for (Topic topic : topics.keySet()) {
                if (discoveryKey(topic).equals(key)) {
                    return topic;
                }
            }
        }
        return null;
    }

    private void dial(String expectedRemote, InetSocketAddress address, String key) {
        Socket socket = new Socket();
        try {
            socket.connect(address, HANDSHAKE_TIMEOUT_MS);
            String remote = handshake(socket, key);
            if (!expectedRemote.equals(remote)) {
                log.log("mesh.lan.identity_mismatch", Map.of("expected", expectedRemote.substring(0, 8)));
                closeQuietly(socket);
                return;
            }
            register(remote, socket);
        } catch (IOException e) {
            log.log("mesh.lan.dial_failed", Map.of("address", address.toString(), "error", String.valueOf(e.getMessage())));
            closeQuietly(socket);
        }
    }

    private void acceptLoop() {
        while (!closed.get()) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (IOException e) {
                if (!closed.get()) {
                    log.log("mesh.lan.accept_failed", Map.of("error", String.valueOf(e.getMessage())));
                }
                return;
            }
            workers.execute(() -> {
                try {
                    register(handshake(socket, null), socket);
                } catch (IOException e) {
                    log.log("mesh.lan.handshake_rejected", Map.of(
                            "address", String.valueOf(socket.getRemoteSocketAddress()),
                            "error", String.valueOf(e.getMessage())
                    ));
                    closeQuietly(socket);
                }
            });
        }
    }

    /**
     * Runs the opening handshake and returns the verified remote identity. {@code dialKey}
     * is the shared discovery key on the dialing side and null on the accepting side.
     */
    private String handshake(Socket socket, String dialKey) throws IOException {
        socket.setSoTimeout(HANDSHAKE_TIMEOUT_MS);
        OutputStream out = socket.getOutputStream();
        InputStream in = socket.getInputStream();
        String nonce = newNonce();
        writeHandshakeLine(out, new HandshakeLine(identity, nonce, null, null));
        HandshakeLine opening = readHandshakeLine(in);
        String remote = opening.id();
        if (remote == null || !IDENTITY_HEX.matcher(remote).matches() || remote.equals(identity)) {
            throw new IOException("invalid remote identity");
        }
        if (opening.nonce() == null || opening.nonce().isBlank()) {
            throw new IOException("missing handshake nonce");
        }
        if (dialKey != null) {
            Topic topic = topicForKey(dialKey);
            if (topic == null) {
                throw new IOException("topic no longer joined");
            }
            writeHandshakeLine(out, new HandshakeLine(null, null, dialKey, proof(topic, identity, remote, opening.nonce())));
            HandshakeLine answer = readHandshakeLine(in);
            if (!dialKey.equals(answer.key())
                    || !Hashing.digestsEqual(proof(topic, remote, identity, nonce), answer.proof())) {
                throw new IOException("remote did not prove the shared topic");
            }
        } else {
            HandshakeLine claim = readHandshakeLine(in);
            Topic topic = topicForKey(claim.key());
            if (topic == null || !Hashing.digestsEqual(proof(topic, remote, identity, nonce), claim.proof())) {
                throw new IOException("caller did not prove a shared topic");
            }
            writeHandshakeLine(out, new HandshakeLine(null, null, claim.key(), proof(topic, identity, remote, opening.nonce())));
        }
        socket.setSoTimeout(0);
        return remote;
    }

    /** HMAC keyed by the topic, binding both identities and the verifier's nonce. */
    static String proof(Topic topic, String prover, String verifier, String verifierNonce) {
        return Hashing.hmacSha256Hex(topic.bytes(), prover + ":" + verifier + ":" + verifierNonce);
    }

    private static void writeHandshakeLine(OutputStream out, HandshakeLine line) throws IOException {
        out.write((Jsons.toLine(line) + "\n").getBytes(StandardCharsets.UTF_8));
        out.flush();
    }

    // Byte at a time, so nothing past the newline is consumed before the stream reader starts.
    private static HandshakeLine readHandshakeLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        while (true) {
            int b = in.read();
            if (b < 0) {
                throw new IOException("connection closed during handshake");
            }
            if (b == '\n') {
                break;
            }
            if (line.size() >= HANDSHAKE_LINE_MAX_BYTES) {
                throw new IOException("handshake line too long");
            }
            line.write(b);
        }
        HandshakeLine parsed = Jsons.mapper().readValue(line.toString(StandardCharsets.UTF_8), HandshakeLine.class);
        if (parsed == null) {
            throw new IOException("empty handshake line");
        }
        return parsed;
    }

    private static String newNonce() {
        byte[] raw = new byte[NONCE_BYTES];
        RANDOM.nextBytes(raw);
        return HexFormat.of().formatHex(raw);
    }

    private void register(String remote, Socket socket) {
        TcpConnection conn = new TcpConnection(remote, socket);
        if (closed.get() || connections.putIfAbsent(remote, conn) != null) {
            closeQuietly(socket);
            return;
        }
        log.log("mesh.lan.connected", Map.of("peer", remote.substring(0, 8)));
        workers.execute(conn::readLoop);
        workers.execute(conn::writeLoop);
        Consumer<MeshConnection> handler = connectionHandler;
        if (handler != null) {
            handler.accept(conn);
        }
    }

    static String discoveryKey(Topic topic) {
        return Hashing.sha256Hex(topic.bytes());
    }

    /** Splits the keys over as many datagrams as needed to stay under the receive buffer. */
    static List<byte[]> announcementPackets(String identity, int port, List<String> keys) {
        List<byte[]> packets = new ArrayList<>();
        for (int from = 0; from < keys.size(); from += KEYS_PER_ANNOUNCEMENT) {
            List<String> slice = keys.subList(from, Math.min(keys.size(), from + KEYS_PER_ANNOUNCEMENT));
            packets.add(Jsons.toLine(new Announcement(identity, port, slice)).getBytes(StandardCharsets.UTF_8));
        }
        return packets;
    }

    private static Thread daemonThread(Runnable r, String name) {
        Thread thread = new Thread(r, name);
        thread.setDaemon(true);
        return thread;
    }

    private static void closeQuietly(AutoCloseable closeable) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception ignored) {
            // Already closing; nothing else to release.
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Announcement(String id, int port, List<String> keys) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    record HandshakeLine(String id, String nonce, String key, String proof) {
    }

    private final class TcpConnection implements MeshConnection {
        private final String remoteIdentity;
        private final Socket socket;
        private final OutboundQueue outbound;
        private final List<byte[]> pending;
        private final AtomicBoolean open;
        private StreamHandler handler;
        private boolean closeDelivered;

        TcpConnection(String remoteIdentity, Socket socket) {
            this.remoteIdentity = remoteIdentity;
            this.socket = socket;
            this.outbound = new OutboundQueue(MAX_QUEUED_WRITE_BYTES);
            this.pending = new ArrayList<>();
            this.open = new AtomicBoolean(true);
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
            if (!open.get() && !closeDelivered) {
                closeDelivered = true;
                handler.onClose();
            }
        }

        @Override
        public boolean isWritable() {
            return open.get();
        }

        @Override
        public void write(byte[] bytes) {
            if (open.get() && !outbound.offer(bytes.clone())) {
                log.log("mesh.lan.write_backlog", Map.of("peer", remoteIdentity.substring(0, 8)));
                close();
            }
        }

        @Override
        public void close() {
            if (!open.compareAndSet(true, false)) {
                return;
            }
            outbound.close();
            closeQuietly(socket);
            connections.remove(remoteIdentity, this);
            log.log("mesh.lan.disconnected", Map.of("peer", remoteIdentity.substring(0, 8)));
            deliverClose();
        }

        void readLoop() {
            byte[] buf = new byte[READ_CHUNK_BYTES];
            try {
                InputStream in = socket.getInputStream();
                int n;
                while ((n = in.read(buf)) >= 0) {
                    if (n > 0) {
                        deliver(Arrays.copyOf(buf, n));
                    }
                }
            } catch (SocketException e) {
                // Socket closed locally or reset by the remote end.
            } catch (IOException e) {
                log.log("mesh.lan.read_failed", Map.of("peer", remoteIdentity.substring(0, 8), "error", String.valueOf(e.getMessage())));
            } finally {
                close();
            }
        }

        void writeLoop() {
            try {
                OutputStream out = socket.getOutputStream();
                while (true) {
                    byte[] next = outbound.take();
                    if (next == null) {
                        return;
                    }
                    out.write(next);
                    out.flush();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (IOException e) {
                close();
            }
        }

        private synchronized void deliver(byte[] chunk) {
            if (handler == null) {
                pending.add(chunk);
            } else {
                handler.onData(chunk);
            }
        }

        private synchronized void deliverClose() {
            if (handler != null && !closeDelivered) {
                closeDelivered = true;
                handler.onClose();
            }
        }
    }
}
