package io.walkie.runtime;

import io.walkie.model.MessageEntry;
import io.walkie.model.PeerFrame;
import io.walkie.model.Topic;
import io.walkie.observability.DaemonLog;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/** Fans local messages out to matched peers and routes peer messages to channels. */
public final class MessageRouter {
    private final ChannelRegistry channels;
    private final String instanceId;
    private final Clock clock;
    private final DaemonLog log;
    private PeerRegistry peers;

    public MessageRouter(ChannelRegistry channels, String instanceId, Clock clock, DaemonLog log) {
        this.channels = channels;
        this.instanceId = instanceId;
        this.clock = clock;
        this.log = log;
    }

    void attach(PeerRegistry peers) {
        this.peers = peers;
    }

    /**
     * Writes {@code payload} to every matched, writable peer of {@code channelName} and
     * returns how many were written to. Zero is a normal result before discovery.
     */
    public int send(String channelName, String payload) {
        Channel channel = channels.require(channelName);
        PeerFrame frame = PeerFrame.msg(channel.topic().hex(), payload, instanceId, clock.millis());
        int delivered = 0;
        for (String identity : channel.matchedPeers()) {
            Optional<Peer> peer = peers.get(identity);
            if (peer.isPresent() && peers.write(peer.get(), frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    void routeInbound(Peer from, PeerFrame frame) {
        Topic topic;
        try {
            topic = Topic.fromHex(frame.topic());
        } catch (IllegalArgumentException e) {
            log.log("peer.frame_dropped", Map.of("peer", from.shortId(), "reason", "bad topic"));
            return;
        }
        Optional<Channel> channel = channels.findByTopic(topic);
        if (channel.isEmpty()) {
            return;
        }
        String origin = frame.id() == null || frame.id().isBlank() ? from.shortId() : frame.id();
        long ts = frame.ts() == null ? clock.millis() : frame.ts();
        channels.deliver(channel.get(), new MessageEntry(origin, frame.data(), ts));
    }
}
