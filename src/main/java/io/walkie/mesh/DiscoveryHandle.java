package io.walkie.mesh;

import java.util.concurrent.CompletableFuture;

public interface DiscoveryHandle {

    /** Completes once the topic has been announced and this node is discoverable under it. */
    CompletableFuture<Void> flushed();

    /** Stops announcing the topic. Existing connections stay open. */
    CompletableFuture<Void> destroy();
}
