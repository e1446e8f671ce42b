package io.walkie.runtime;

import io.walkie.config.DaemonSettings;
import io.walkie.crypto.TopicDerivation;
import io.walkie.mesh.LoopbackMesh;
import io.walkie.model.MessageEntry;
import io.walkie.observability.DaemonLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelRegistryTest {
    private WalkieDaemon daemon;

    @BeforeEach
    void setUp() {
        daemon = new WalkieDaemon("aaaa0001", DaemonSettings.defaults(),
                new LoopbackMesh(new LoopbackMesh.Hub()), DaemonLog.discarding());
        daemon.start();
    }

    @AfterEach
    void tearDown() {
        daemon.close();
    }

    @Test
    void rejoiningSameNameChangesNothing() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        RecordingConnection conn = new RecordingConnection("peer-1");
        onLoop(() -> {
            daemon.peers().onConnection(conn);
            daemon.peers().onData(conn, helloFor("room", "s1"));
            return null;
        });
        Channel before = onLoop(() -> daemon.channels().require("room"));

        daemon.join("room", "other-secret").get(5, TimeUnit.SECONDS);

        assertEquals(1, (int) onLoop(() -> daemon.channels().size()));
        Channel after = onLoop(() -> daemon.channels().require("room"));
        assertSame(before, after);
        assertEquals(Set.of("peer-1"), onLoop(() -> Set.copyOf(after.matchedPeers())));
    }

    @Test
    void readWithoutWaitReturnsBufferedMessagesInArrivalOrder() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        onLoop(() -> {
            Channel channel = daemon.channels().require("room");
            daemon.channels().deliver(channel, entry("one"));
            daemon.channels().deliver(channel, entry("two"));
            return null;
        });

        List<MessageEntry> first = daemon.read("room", false, Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);
        List<MessageEntry> second = daemon.read("room", false, Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("one", "two"), first.stream().map(MessageEntry::data).toList());
        assertTrue(second.isEmpty());
    }

    @Test
    void bufferedMessagesReturnImmediatelyEvenWhenWaiting() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        onLoop(() -> {
            daemon.channels().deliver(daemon.channels().require("room"), entry("ready"));
            return null;
        });
        List<MessageEntry> messages = daemon.read("room", true, Duration.ofSeconds(30)).get(1, TimeUnit.SECONDS);
        assertEquals(1, messages.size());
    }

    @Test
    void waitersAreServedOldestFirstWithOneEntryEach() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        PendingRead first = onLoop(() -> daemon.channels().read("room", true, Duration.ofSeconds(30), () -> true));
        PendingRead second = onLoop(() -> daemon.channels().read("room", true, Duration.ofSeconds(30), () -> true));
        assertFalse(first.isDone());

        onLoop(() -> {
            Channel channel = daemon.channels().require("room");
            daemon.channels().deliver(channel, entry("m1"));
            daemon.channels().deliver(channel, entry("m2"));
            daemon.channels().deliver(channel, entry("m3"));
            return null;
        });

        assertEquals("m1", first.result().get(1, TimeUnit.SECONDS).get(0).data());
        assertEquals(1, first.result().get().size());
        assertEquals("m2", second.result().get(1, TimeUnit.SECONDS).get(0).data());
        Map<String, ChannelRegistry.ChannelStatus> status = daemon.status().get(1, TimeUnit.SECONDS);
        assertEquals(1, status.get("room").buffered());
        assertEquals(0, (int) onLoop(() -> daemon.channels().require("room").waiterCount()));
    }

    @Test
    void waitingReadResolvesEmptyAfterTimeoutAndNotBefore() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        long startedAt = System.nanoTime();
        CompletableFuture<List<MessageEntry>> result = daemon.read("room", true, Duration.ofMillis(400));

        Thread.sleep(150L);
        assertFalse(result.isDone());

        List<MessageEntry> messages = result.get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
        assertTrue(messages.isEmpty());
        assertTrue(elapsedMs >= 400L, "resolved after " + elapsedMs + "ms");
        assertEquals(0, (int) onLoop(() -> daemon.channels().require("room").waiterCount()));
    }

    @Test
    void messageAfterTimeoutIsBufferedNotLost() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        daemon.read("room", true, Duration.ofMillis(50)).get(5, TimeUnit.SECONDS);
        onLoop(() -> {
            daemon.channels().deliver(daemon.channels().require("room"), entry("late"));
            return null;
        });
        assertEquals(1, daemon.status().get(1, TimeUnit.SECONDS).get("room").buffered());
    }

    @Test
    void leaveReleasesWaitersWithEmptyResult() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        CompletableFuture<List<MessageEntry>> pending = daemon.read("room", true, Duration.ofSeconds(30));
        Thread.sleep(50L);

        daemon.leave("room").get(5, TimeUnit.SECONDS);

        assertTrue(pending.get(1, TimeUnit.SECONDS).isEmpty());
        assertTrue(daemon.status().get(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void waiterOfDisconnectedClientIsSkipped() throws Exception {
        daemon.join("room", "s1").get(5, TimeUnit.SECONDS);
        PendingRead gone = onLoop(() -> daemon.channels().read("room", true, Duration.ofSeconds(30), () -> false));
        onLoop(() -> {
            daemon.channels().deliver(daemon.channels().require("room"), entry("kept"));
            return null;
        });
        assertTrue(gone.result().get(1, TimeUnit.SECONDS).isEmpty());
        assertEquals(1, daemon.status().get(1, TimeUnit.SECONDS).get("room").buffered());
    }

    @Test
    void readingUnknownChannelFailsWithNotInChannel() {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> daemon.read("nowhere", false, Duration.ofSeconds(1)).get(5, TimeUnit.SECONDS));
        ControlException cause = assertInstanceOf(ControlException.class, error.getCause());
        assertEquals(ControlException.Reason.NOT_IN_CHANNEL, cause.reason());
        assertEquals("Not in channel: nowhere", cause.getMessage());
    }

    @Test
    void leavingUnknownChannelIsNoOp() throws Exception {
        daemon.leave("nowhere").get(5, TimeUnit.SECONDS);
        assertTrue(daemon.status().get(1, TimeUnit.SECONDS).isEmpty());
    }

    private <T> T onLoop(Callable<T> task) throws Exception {
        return daemon.loop().submit(task).get(5, TimeUnit.SECONDS);
    }

    private static MessageEntry entry(String data) {
        return new MessageEntry("remote01", data, System.currentTimeMillis());
    }

    static byte[] helloFor(String channel, String secret) {
        String topic = TopicDerivation.deriveTopic(channel, secret).hex();
        return ("{\"t\":\"hello\",\"topics\":[\"" + topic + "\"],\"id\":\"remote01\"}\n")
                .getBytes(StandardCharsets.UTF_8);
    }
}
