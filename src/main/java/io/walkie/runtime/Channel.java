package io.walkie.runtime;

import io.walkie.mesh.DiscoveryHandle;
import io.walkie.model.MessageEntry;
import io.walkie.model.Topic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A joined channel. Buffered messages and waiting readers are never both non-empty:
 * a new message goes to the oldest live waiter if there is one, otherwise to the buffer.
 */
public final class Channel {
    private final String name;
    private final Topic topic;
    private final DiscoveryHandle discovery;
    private final Set<String> matchedPeers;
    private final Deque<MessageEntry> pending;
    private final Deque<PendingRead> waiters;

    Channel(String name, Topic topic, DiscoveryHandle discovery) {
        this.name = name;
        this.topic = topic;
        this.discovery = discovery;
        this.matchedPeers = new LinkedHashSet<>();
        this.pending = new ArrayDeque<>();
        this.waiters = new ArrayDeque<>();
    }

    public String name() {
        return name;
    }

    public Topic topic() {
        return topic;
    }

    DiscoveryHandle discovery() {
        return discovery;
    }

    public Set<String> matchedPeers() {
        return Collections.unmodifiableSet(matchedPeers);
    }

    boolean addMatchedPeer(String identity) {
        return matchedPeers.add(identity);
    }

    boolean removeMatchedPeer(String identity) {
        return matchedPeers.remove(identity);
    }

    public int bufferedCount() {
        return pending.size();
    }

    public int waiterCount() {
        return waiters.size();
    }

    /** Hands {@code entry} to the oldest waiter whose client is still connected, else buffers it. */
    void offer(MessageEntry entry) {
        PendingRead waiter;
        while ((waiter = waiters.poll()) != null) {
            if (!waiter.clientAlive()) {
                waiter.resolve(List.of());
                continue;
            }
            if (waiter.resolve(List.of(entry))) {
                return;
            }
        }
        pending.add(entry);
    }

    List<MessageEntry> drain() {
        List<MessageEntry> out = new ArrayList<>(pending);
        pending.clear();
        return out;
    }

    void addWaiter(PendingRead waiter) {
        if (!pending.isEmpty()) {
            throw new IllegalStateException("waiter registered while messages are buffered");
        }
        waiters.add(waiter);
    }

    void removeWaiter(PendingRead waiter) {
        waiters.remove(waiter);
    }

    void releaseWaiters() {
        PendingRead waiter;
        while ((waiter = waiters.poll()) != null) {
            waiter.resolve(List.of());
        }
    }
}
