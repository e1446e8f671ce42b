package io.walkie.runtime;

import io.walkie.crypto.TopicDerivation;
import io.walkie.mesh.DiscoveryHandle;
import io.walkie.mesh.MeshSubstrate;
import io.walkie.model.MessageEntry;
import io.walkie.model.Topic;
import io.walkie.observability.DaemonLog;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;

/**
 * Joined channels by name. Every method runs on the event loop; futures returned
 * here are also completed on the loop.
 */
public final class ChannelRegistry {
    private final EventLoop loop;
    private final MeshSubstrate mesh;
    private final DaemonLog log;
    private final Map<String, Channel> channels;
    private final Map<String, CompletableFuture<Channel>> joining;
    private MembershipListener listener;
    private boolean closed;

    public ChannelRegistry(EventLoop loop, MeshSubstrate mesh, DaemonLog log) {
        this.loop = loop;
        this.mesh = mesh;
        this.log = log;
        this.channels = new LinkedHashMap<>();
        this.joining = new LinkedHashMap<>();
        this.listener = MembershipListener.NONE;
    }

    void setListener(MembershipListener listener) {
        this.listener = listener == null ? MembershipListener.NONE : listener;
    }

    /**
     * Joins {@code name}, completing once the mesh reports the topic discoverable.
     * Joining a name that is already joined, or still being joined, changes nothing.
     */
    public CompletableFuture<Channel> join(String name, String secret) {
        Channel existing = channels.get(name);
        if (existing != null) {
            return CompletableFuture.completedFuture(existing);
        }
        CompletableFuture<Channel> inFlight = joining.get(name);
        if (inFlight != null) {
            return inFlight;
        }
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Daemon is shutting down"));
        }
        Topic topic = TopicDerivation.deriveTopic(name, secret);
        log.log("channel.join", Map.of("channel", name, "topic", topic.shortHex()));
        DiscoveryHandle discovery = mesh.join(topic);
        CompletableFuture<Channel> result = new CompletableFuture<>();
        joining.put(name, result);
        discovery.flushed().whenComplete((ignored, error) ->
                loop.execute(() -> finishJoin(name, topic, discovery, error, result)));
        return result;
    }

    private void finishJoin(String name, Topic topic, DiscoveryHandle discovery, Throwable error, CompletableFuture<Channel> result) {
        joining.remove(name);
        if (error != null || closed) {
            discovery.destroy();
            log.log("channel.join_failed", Map.of(
                    "channel", name,
                    "error", error == null ? "shutting down" : String.valueOf(error.getMessage())
            ));
            result.completeExceptionally(error != null ? error : new IllegalStateException("Daemon is shutting down"));
            return;
        }
        log.log("channel.flushed", Map.of("channel", name, "topic", topic.shortHex()));
        Channel channel = new Channel(name, topic, discovery);
        channels.put(name, channel);
        listener.channelJoined(channel);
        result.complete(channel);
    }

    /** Leaves {@code name}; outstanding readers get an empty result. Leaving an unknown name is a no-op. */
    public CompletableFuture<Void> leave(String name) {
        Channel channel = channels.remove(name);
        if (channel == null) {
            return CompletableFuture.completedFuture(null);
        }
        channel.releaseWaiters();
        listener.channelLeft(channel);
        log.log("channel.leave", Map.of("channel", name, "topic", channel.topic().shortHex()));
        return channel.discovery().destroy();
    }

    public Optional<Channel> get(String name) {
        return Optional.ofNullable(channels.get(name));
    }

    public Channel require(String name) {
        Channel channel = channels.get(name);
        if (channel == null) {
            throw ControlException.notInChannel(name);
        }
        return channel;
    }

    public Optional<Channel> findByTopic(Topic topic) {
        for (Channel channel : channels.values()) {
            if (channel.topic().equals(topic)) {
                return Optional.of(channel);
            }
        }
        return Optional.empty();
    }

    public Collection<Channel> all() {
        return Collections.unmodifiableCollection(channels.values());
    }

    public List<String> topicHexes() {
        List<String> out = new ArrayList<>(channels.size());
        for (Channel channel : channels.values()) {
            out.add(channel.topic().hex());
        }
        return out;
    }

    public int size() {
        return channels.size();
    }

    public Map<String, ChannelStatus> status() {
        Map<String, ChannelStatus> out = new LinkedHashMap<>();
        for (Channel channel : channels.values()) {
            out.put(channel.name(), new ChannelStatus(channel.matchedPeers().size(), channel.bufferedCount()));
        }
        return out;
    }

    /**
     * Reads {@code name}. Buffered messages, or an empty list when {@code wait} is false,
     * come back at once. Otherwise the read suspends until one message arrives or
     * {@code timeout} passes, whichever is first.
     */
    public PendingRead read(String name, boolean wait, Duration timeout, BooleanSupplier clientAlive) {
        Channel channel = require(name);
        PendingRead read = new PendingRead(channel, clientAlive);
        if (channel.bufferedCount() > 0 || !wait) {
            read.resolve(channel.drain());
            return read;
        }
        channel.addWaiter(read);
        read.armTimer(loop.schedule(() -> {
            channel.removeWaiter(read);
            read.resolve(List.of());
        }, timeout));
        return read;
    }

    /** Withdraws a suspended read whose client went away. */
    public void cancel(PendingRead read) {
        read.channel().removeWaiter(read);
        read.resolve(List.of());
    }

    void deliver(Channel channel, MessageEntry entry) {
        channel.offer(entry);
    }

    /** Releases every topic; called once at shutdown. */
    public void closeAll() {
        closed = true;
        for (Channel channel : new ArrayList<>(channels.values())) {
            channel.releaseWaiters();
            channel.discovery().destroy();
        }
        channels.clear();
    }

    public record ChannelStatus(int peers, int buffered) {
    }

    interface MembershipListener {
        MembershipListener NONE = new MembershipListener() {
            @Override
            public void channelJoined(Channel channel) {
            }

            @Override
            public void channelLeft(Channel channel) {
            }
        };

        void channelJoined(Channel channel);

        void channelLeft(Channel channel);
    }
}
