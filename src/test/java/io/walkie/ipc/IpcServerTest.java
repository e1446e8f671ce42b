package io.walkie.ipc;

import com.fasterxml.jackson.databind.JsonNode;
import io.walkie.config.DaemonSettings;
import io.walkie.mesh.LoopbackMesh;
import io.walkie.observability.DaemonLog;
import io.walkie.runtime.WalkieDaemon;
import io.walkie.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IpcServerTest {
    private static final int MAX_MESSAGE = 2048;

    private Path root;
    private WalkieDaemon daemon;
    private IpcServer server;
    private IpcClient client;
    private CountDownLatch stopped;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("walkie-ipc-");
        DaemonSettings settings = new DaemonSettings(
                8192, 8192, MAX_MESSAGE, 30_000L, 17890, 17891, 1_000L, null);
        daemon = new WalkieDaemon("d0d0d0d0", settings,
                new LoopbackMesh(new LoopbackMesh.Hub()), DaemonLog.discarding());
        daemon.start();
        stopped = new CountDownLatch(1);
        server = new IpcServer(root.resolve("daemon.sock"), daemon, stopped::countDown);
        server.start();
        client = new IpcClient(server.socketPath());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
        daemon.close();
        deleteRecursively(root);
    }

    @Test
    void pingAnswersOk() throws Exception {
        JsonNode reply = client.call(IpcClient.request("ping"));
        assertTrue(reply.path("ok").asBoolean());
    }

    @Test
    void unknownActionIsRejected() throws Exception {
        JsonNode reply = client.call(IpcClient.request("dance"));
        assertFalse(reply.path("ok").asBoolean());
        assertEquals("Unknown action: dance", reply.path("error").asText());
    }

    @Test
    void joinSendReadAndStatusRoundTrip() throws Exception {
        JsonNode joined = client.call(IpcClient.request("join").put("channel", "room").put("secret", "s1"));
        assertTrue(joined.path("ok").asBoolean());
        assertEquals("room", joined.path("channel").asText());

        JsonNode sent = client.call(IpcClient.request("send").put("channel", "room").put("message", "hi"));
        assertTrue(sent.path("ok").asBoolean());
        assertEquals(0, sent.path("delivered").asInt());

        JsonNode read = client.call(IpcClient.request("read").put("channel", "room"));
        assertTrue(read.path("ok").asBoolean());
        assertEquals(0, read.path("messages").size());

        JsonNode status = client.call(IpcClient.request("status"));
        assertTrue(status.path("ok").asBoolean());
        assertEquals("d0d0d0d0", status.path("daemonId").asText());
        assertEquals(0, status.path("channels").path("room").path("peers").asInt());
        assertEquals(0, status.path("channels").path("room").path("buffered").asInt());

        JsonNode left = client.call(IpcClient.request("leave").put("channel", "room"));
        assertTrue(left.path("ok").asBoolean());
        assertFalse(client.call(IpcClient.request("status")).path("channels").has("room"));
    }

    @Test
    void invalidJsonGetsErrorAndConnectionStaysOpen() throws Exception {
        try (RawClient raw = new RawClient(server.socketPath())) {
            raw.send("{not json\n");
            JsonNode error = raw.receive();
            assertFalse(error.path("ok").asBoolean());
            assertTrue(error.path("error").asText().startsWith("Invalid JSON"));

            raw.send("{\"action\":\"ping\"}\n");
            assertTrue(raw.receive().path("ok").asBoolean());
        }
    }

    @Test
    void severalRequestsInOneChunkGetRepliesInOrder() throws Exception {
        try (RawClient raw = new RawClient(server.socketPath())) {
            raw.send("{\"action\":\"ping\"}\n{\"action\":\"nope\"}\n{\"action\":\"status\"}\n");
            assertTrue(raw.receive().path("ok").asBoolean());
            assertEquals("Unknown action: nope", raw.receive().path("error").asText());
            assertEquals("d0d0d0d0", raw.receive().path("daemonId").asText());
        }
    }

    @Test
    void oversizedRequestIsRefusedAndConnectionClosed() throws Exception {
        try (RawClient raw = new RawClient(server.socketPath())) {
            raw.send("x".repeat(9000));
            JsonNode error = raw.receive();
            assertFalse(error.path("ok").asBoolean());
            assertEquals("Request too large", error.path("error").asText());
            assertClosedByServer(raw);
        }
        assertTrue(client.call(IpcClient.request("ping")).path("ok").asBoolean());
    }

    @Test
    void oversizedMessageIsRefusedBeforeMembershipCheck() throws Exception {
        JsonNode reply = client.call(IpcClient.request("send")
                .put("channel", "never-joined")
                .put("message", "m".repeat(MAX_MESSAGE + 1)));
        assertFalse(reply.path("ok").asBoolean());
        assertEquals("Message too large (max 2KB)", reply.path("error").asText());
    }

    @Test
    void messageExactlyAtLimitIsAccepted() throws Exception {
        client.call(IpcClient.request("join").put("channel", "room").put("secret", "s1"));
        JsonNode reply = client.call(IpcClient.request("send")
                .put("channel", "room")
                .put("message", "m".repeat(MAX_MESSAGE)));
        assertTrue(reply.path("ok").asBoolean());
        assertEquals(0, reply.path("delivered").asInt());
    }

    @Test
    void messageLimitCountsUtf8Bytes() throws Exception {
        client.call(IpcClient.request("join").put("channel", "room").put("secret", "s1"));
        // Two bytes per character, so half as many characters fill the limit.
        String atLimit = "é".repeat(MAX_MESSAGE / 2);

        JsonNode accepted = client.call(IpcClient.request("send").put("channel", "room").put("message", atLimit));
        assertTrue(accepted.path("ok").asBoolean());

        JsonNode refused = client.call(IpcClient.request("send").put("channel", "room").put("message", atLimit + "m"));
        assertFalse(refused.path("ok").asBoolean());
        assertEquals("Message too large (max 2KB)", refused.path("error").asText());
    }

    @Test
    void sendToUnjoinedChannelIsRejected() throws Exception {
        JsonNode reply = client.call(IpcClient.request("send").put("channel", "room").put("message", "hi"));
        assertFalse(reply.path("ok").asBoolean());
        assertEquals("Not in channel: room", reply.path("error").asText());
    }

    @Test
    void waitingReadTimesOutWithEmptyList() throws Exception {
        client.call(IpcClient.request("join").put("channel", "room").put("secret", "s1"));
        long started = System.nanoTime();
        JsonNode reply = client.call(IpcClient.request("read")
                .put("channel", "room").put("wait", true).put("timeout", 1));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(reply.path("ok").asBoolean());
        assertEquals(0, reply.path("messages").size());
        assertTrue(elapsedMs >= 900L, "returned after " + elapsedMs + "ms");
    }

    @Test
    void clientDisconnectWithdrawsSuspendedRead() throws Exception {
        client.call(IpcClient.request("join").put("channel", "room").put("secret", "s1"));
        try (RawClient raw = new RawClient(server.socketPath())) {
            raw.send("{\"action\":\"read\",\"channel\":\"room\",\"wait\":true,\"timeout\":30}\n");
            awaitWaiters(1);
        }
        awaitWaiters(0);
    }

    @Test
    void stopRepliesThenRunsStopAction() throws Exception {
        JsonNode reply = client.call(IpcClient.request("stop"));
        assertTrue(reply.path("ok").asBoolean());
        assertTrue(stopped.await(5, TimeUnit.SECONDS));
    }

    @Test
    void closeRemovesSocketFile() {
        assertTrue(Files.exists(server.socketPath()));
        server.close();
        assertFalse(Files.exists(server.socketPath()));
    }

    private static void assertClosedByServer(RawClient raw) {
        try {
            assertNull(raw.receiveRaw());
        } catch (IOException e) {
            // A reset is also a close when the rejected request was not fully read.
        }
    }

    private void awaitWaiters(int expected) throws Exception {
        long deadline = System.currentTimeMillis() + 5_000L;
        int waiters = -1;
        while (System.currentTimeMillis() < deadline) {
            waiters = daemon.loop().submit(() -> daemon.channels().require("room").waiterCount())
                    .get(5, TimeUnit.SECONDS);
            if (waiters == expected) {
                return;
            }
            Thread.sleep(20L);
        }
        assertEquals(expected, waiters);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class RawClient implements AutoCloseable {
        private final SocketChannel socket;
        private final BufferedReader reader;

        RawClient(Path socketPath) throws IOException {
            this.socket = SocketChannel.open(StandardProtocolFamily.UNIX);
            this.socket.connect(UnixDomainSocketAddress.of(socketPath));
            this.reader = new BufferedReader(
                    new InputStreamReader(Channels.newInputStream(socket), StandardCharsets.UTF_8));
        }

        void send(String text) throws IOException {
            ByteBuffer out = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
            while (out.hasRemaining()) {
                socket.write(out);
            }
        }

        String receiveRaw() throws IOException {
            return reader.readLine();
        }

        JsonNode receive() throws IOException {
            String line = receiveRaw();
            if (line == null) {
                throw new IOException("connection closed");
            }
            return Jsons.mapper().readTree(line);
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
