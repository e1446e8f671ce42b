package io.walkie.ipc;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walkie.runtime.PendingRead;

/** The requesting side of one local control connection, as seen by the dispatcher. */
public interface ClientHandle {

    /** Queues one reply line. Safe from any thread; dropped once the connection is closed. */
    void reply(ObjectNode body);

    boolean isOpen();

    /** Remembers a suspended read so it can be withdrawn if the connection goes away. */
    void track(PendingRead read);
}
