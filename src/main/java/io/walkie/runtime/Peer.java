package io.walkie.runtime;

import io.walkie.mesh.MeshConnection;
import io.walkie.model.Topic;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/** One live mesh connection, owned by {@link PeerRegistry}. */
public final class Peer {
    private final MeshConnection connection;
    private final LineFramer framer;
    private final Set<Topic> matchedTopics;
    private Set<String> knownTopics;

    Peer(MeshConnection connection, int maxBufferBytes) {
        this.connection = connection;
        this.framer = new LineFramer(maxBufferBytes);
        this.matchedTopics = new LinkedHashSet<>();
    }

    public String identity() {
        return connection.remoteIdentity();
    }

    public String shortId() {
        String id = identity();
        return id.length() <= 8 ? id : id.substring(0, 8);
    }

    public MeshConnection connection() {
        return connection;
    }

    LineFramer framer() {
        return framer;
    }

    /** Topic hexes from the last hello, or null before the first hello. */
    Set<String> knownTopics() {
        return knownTopics;
    }

    void knownTopics(Set<String> topics) {
        this.knownTopics = topics;
    }

    public Set<Topic> matchedTopics() {
        return Collections.unmodifiableSet(matchedTopics);
    }

    boolean addMatchedTopic(Topic topic) {
        return matchedTopics.add(topic);
    }

    void removeMatchedTopic(Topic topic) {
        matchedTopics.remove(topic);
    }
}
