package io.walkie.ipc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walkie.util.Jsons;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/** Sends one control request to a running daemon and returns its reply. */
public final class IpcClient {
    private final Path socketPath;

    public IpcClient(Path socketPath) {
        this.socketPath = socketPath;
    }

    public static ObjectNode request(String action) {
        return Jsons.mapper().createObjectNode().put("action", action);
    }

    public JsonNode call(ObjectNode request) throws IOException {
        try (SocketChannel socket = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            socket.connect(UnixDomainSocketAddress.of(socketPath));
            ByteBuffer out = ByteBuffer.wrap((Jsons.toLine(request) + "\n").getBytes(StandardCharsets.UTF_8));
            while (out.hasRemaining()) {
                socket.write(out);
            }
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(Channels.newInputStream(socket), StandardCharsets.UTF_8));
            String line = reader.readLine();
            if (line == null) {
                throw new IOException("Daemon closed the connection without replying");
            }
            return Jsons.mapper().readTree(line);
        }
    }
}
