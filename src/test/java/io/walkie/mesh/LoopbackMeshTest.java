package io.walkie.mesh;

import io.walkie.crypto.TopicDerivation;
import io.walkie.model.Topic;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LoopbackMeshTest {
    private final Topic room = TopicDerivation.deriveTopic("room", "s1");
    private final Topic other = TopicDerivation.deriveTopic("room", "s2");

    @Test
    void sharedTopicConnectsPairOnce() {
        LoopbackMesh.Hub hub = new LoopbackMesh.Hub();
        LoopbackMesh a = new LoopbackMesh(hub, "a");
        LoopbackMesh b = new LoopbackMesh(hub, "b");
        List<MeshConnection> seenByA = new ArrayList<>();
        List<MeshConnection> seenByB = new ArrayList<>();
        a.onConnection(seenByA::add);
        b.onConnection(seenByB::add);

        a.join(room);
        b.join(room);
        b.join(other);
        a.join(other);

        assertEquals(1, seenByA.size());
        assertEquals(1, seenByB.size());
        assertEquals("b", seenByA.get(0).remoteIdentity());
        assertEquals("a", seenByB.get(0).remoteIdentity());
        assertEquals(1, a.connectionCount());
    }

    @Test
    void distinctTopicsDoNotConnect() {
        LoopbackMesh.Hub hub = new LoopbackMesh.Hub();
        LoopbackMesh a = new LoopbackMesh(hub, "a");
        LoopbackMesh b = new LoopbackMesh(hub, "b");
        a.join(room);
        b.join(other);
        assertEquals(0, a.connectionCount());
        assertEquals(0, b.connectionCount());
    }

    @Test
    void dataWrittenBeforeHandlerIsReplayedInOrder() {
        LoopbackMesh.Hub hub = new LoopbackMesh.Hub();
        LoopbackMesh a = new LoopbackMesh(hub, "a");
        LoopbackMesh b = new LoopbackMesh(hub, "b");
        List<MeshConnection> atA = new ArrayList<>();
        List<MeshConnection> atB = new ArrayList<>();
        a.onConnection(atA::add);
        b.onConnection(atB::add);
        a.join(room);
        b.join(room);

        atA.get(0).write("one\n".getBytes(StandardCharsets.UTF_8));
        atA.get(0).write("two\n".getBytes(StandardCharsets.UTF_8));
        StringBuilder received = new StringBuilder();
        atB.get(0).setHandler(new StreamHandler() {
            @Override
            public void onData(byte[] chunk) {
                received.append(new String(chunk, StandardCharsets.UTF_8));
            }

            @Override
            public void onClose() {
            }
        });
        atA.get(0).write("three\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("one\ntwo\nthree\n", received.toString());
    }

    @Test
    void disconnectClosesBothEndsOnce() {
        LoopbackMesh.Hub hub = new LoopbackMesh.Hub();
        LoopbackMesh a = new LoopbackMesh(hub, "a");
        LoopbackMesh b = new LoopbackMesh(hub, "b");
        List<MeshConnection> atB = new ArrayList<>();
        b.onConnection(atB::add);
        a.join(room);
        b.join(room);
        AtomicInteger closes = new AtomicInteger();
        atB.get(0).setHandler(new StreamHandler() {
            @Override
            public void onData(byte[] chunk) {
            }

            @Override
            public void onClose() {
                closes.incrementAndGet();
            }
        });

        a.disconnect("b");
        a.disconnect("b");

        assertEquals(1, closes.get());
        assertFalse(atB.get(0).isWritable());
        assertEquals(0, a.connectionCount());
        assertEquals(0, b.connectionCount());
    }

    @Test
    void leftTopicNoLongerConnectsNewcomers() {
        LoopbackMesh.Hub hub = new LoopbackMesh.Hub();
        LoopbackMesh a = new LoopbackMesh(hub, "a");
        LoopbackMesh b = new LoopbackMesh(hub, "b");
        a.join(room).destroy().join();
        b.join(room);
        assertEquals(0, b.connectionCount());
    }

    @Test
    void duplicateIdentityIsRejectedAndClosedNodeCannotJoin() {
        LoopbackMesh.Hub hub = new LoopbackMesh.Hub();
        LoopbackMesh a = new LoopbackMesh(hub, "a");
        assertThrows(IllegalArgumentException.class, () -> new LoopbackMesh(hub, "a"));
        a.close();
        assertThrows(IllegalStateException.class, () -> a.join(room));
        assertEquals("a", a.identity());
    }
}
