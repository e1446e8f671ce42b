package io.walkie.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.walkie.mesh.MeshConnection;
import io.walkie.model.PeerFrame;
import io.walkie.observability.DaemonLog;
import io.walkie.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Live peers by mesh identity, plus the hello/topic matching handshake. Runs on the
 * event loop only.
 *
 * <p>Matching is symmetric and driven by hellos from either side: a peer is matched to
 * a local channel once its latest hello lists that channel's topic. Each connection
 * gets a hello on open, and every open connection gets a fresh one whenever a channel
 * is joined, so a remote side that joined first is picked up without reconnecting.
 */
public final class PeerRegistry implements ChannelRegistry.MembershipListener {
    private final ChannelRegistry channels;
    private final MessageRouter router;
    private final String instanceId;
    private final int maxBufferBytes;
    private final int maxMessageBytes;
    private final DaemonLog log;
    private final Map<String, Peer> peers;

    public PeerRegistry(
            ChannelRegistry channels,
            MessageRouter router,
            String instanceId,
            int maxBufferBytes,
            int maxMessageBytes,
            DaemonLog log
    ) {
        this.channels = channels;
        this.router = router;
        this.instanceId = instanceId;
        this.maxBufferBytes = maxBufferBytes;
        this.maxMessageBytes = maxMessageBytes;
        this.log = log;
        this.peers = new LinkedHashMap<>();
    }

    public void onConnection(MeshConnection connection) {
        Peer previous = peers.get(connection.remoteIdentity());
        if (previous != null && previous.connection() != connection) {
            // Same identity on a new stream: the old stream is finished.
            detach(previous);
            previous.connection().close();
        }
        Peer peer = new Peer(connection, maxBufferBytes);
        peers.put(peer.identity(), peer);
        log.log("peer.connected", Map.of("peer", peer.shortId()));
        sendHello(peer);
    }

    public void onData(MeshConnection connection, byte[] chunk) {
        Peer peer = current(connection);
        if (peer == null) {
            return;
        }
        List<String> records;
        try {
            records = peer.framer().append(chunk);
        } catch (LineFramer.FrameOverflowException e) {
            log.log("peer.buffer_overflow", Map.of("peer", peer.shortId(), "limit", maxBufferBytes));
            detach(peer);
            connection.close();
            return;
        }
        for (String record : records) {
            onRecord(peer, record);
            if (current(connection) == null) {
                return;
            }
        }
    }

    public void onClose(MeshConnection connection) {
        Peer peer = current(connection);
        if (peer != null) {
            detach(peer);
            log.log("peer.closed", Map.of("peer", peer.shortId()));
        }
    }

    @Override
    public void channelJoined(Channel channel) {
        reannounce();
    }

    @Override
    public void channelLeft(Channel channel) {
        for (String identity : channel.matchedPeers()) {
            Peer peer = peers.get(identity);
            if (peer != null) {
                peer.removeMatchedTopic(channel.topic());
            }
        }
    }

    /** Sends the current topic list to every open connection and matches topics already heard. */
    public void reannounce() {
        List<String> topics = channels.topicHexes();
        for (Peer peer : peers.values()) {
            if (peer.connection().isWritable()) {
                log.log("peer.reannounce", Map.of("peer", peer.shortId(), "topics", topics.size()));
                write(peer, PeerFrame.hello(topics, instanceId));
            }
            match(peer, "peer.late_matched");
        }
    }

    public Optional<Peer> get(String identity) {
        return Optional.ofNullable(peers.get(identity));
    }

    public int size() {
        return peers.size();
    }

    /** Closes every connection; called once at shutdown. */
    public void closeAll() {
        for (Peer peer : new ArrayList<>(peers.values())) {
            detach(peer);
            peer.connection().close();
        }
    }

    boolean write(Peer peer, PeerFrame frame) {
        MeshConnection connection = peer.connection();
        if (!connection.isWritable()) {
            return false;
        }
        connection.write((Jsons.toLine(frame) + "\n").getBytes(StandardCharsets.UTF_8));
        return true;
    }

    private void onRecord(Peer peer, String record) {
        PeerFrame frame;
        try {
            frame = Jsons.mapper().readValue(record, PeerFrame.class);
        } catch (JsonProcessingException e) {
            log.log("peer.frame_dropped", Map.of("peer", peer.shortId(), "reason", "malformed"));
            return;
        }
        if (frame == null) {
            return;
        }
        if (frame.isHello()) {
            onHello(peer, frame);
        } else if (frame.isMsg()) {
            onMsg(peer, frame);
        }
    }

    private void onHello(Peer peer, PeerFrame frame) {
        Set<String> topics = new HashSet<>();
        if (frame.topics() != null) {
            for (String topic : frame.topics()) {
                if (topic != null) {
                    topics.add(topic.toLowerCase());
                }
            }
        }
        peer.knownTopics(topics);
        log.log("peer.hello", Map.of("peer", peer.shortId(), "topics", topics.size()));
        match(peer, "peer.matched");
    }

    private void onMsg(Peer peer, PeerFrame frame) {
        if (frame.data() == null || frame.topic() == null) {
            log.log("peer.frame_dropped", Map.of("peer", peer.shortId(), "reason", "incomplete"));
            return;
        }
        if (frame.data().getBytes(StandardCharsets.UTF_8).length > maxMessageBytes) {
            log.log("peer.message_dropped", Map.of("peer", peer.shortId(), "reason", "oversized"));
            return;
        }
        router.routeInbound(peer, frame);
    }

    private void match(Peer peer, String event) {
        Set<String> known = peer.knownTopics();
        if (known == null) {
            return;
        }
        for (Channel channel : channels.all()) {
            if (known.contains(channel.topic().hex()) && channel.addMatchedPeer(peer.identity())) {
                peer.addMatchedTopic(channel.topic());
                log.log(event, Map.of("peer", peer.shortId(), "topic", channel.topic().shortHex()));
            }
        }
    }

    private void sendHello(Peer peer) {
        write(peer, PeerFrame.hello(channels.topicHexes(), instanceId));
    }

    private Peer current(MeshConnection connection) {
        Peer peer = peers.get(connection.remoteIdentity());
        return peer != null && peer.connection() == connection ? peer : null;
    }

    private void detach(Peer peer) {
        for (Channel channel : channels.all()) {
            channel.removeMatchedPeer(peer.identity());
        }
        peers.remove(peer.identity(), peer);
    }
}
