package io.walkie.mesh;

import io.walkie.model.Topic;

import java.util.function.Consumer;

/**
 * Discovery and transport layer under the daemon. Implementations connect this node
 * to other nodes that joined a common topic and report each new connection once.
 */
public interface MeshSubstrate extends AutoCloseable {

    /** Registers the handler for new connections. Must be called before the first {@link #join}. */
    void onConnection(Consumer<MeshConnection> handler);

    DiscoveryHandle join(Topic topic);

    /** Releases every topic and closes every connection. Safe to call more than once. */
    @Override
    void close();
}
