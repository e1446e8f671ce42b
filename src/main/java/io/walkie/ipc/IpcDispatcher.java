package io.walkie.ipc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.walkie.model.MessageEntry;
import io.walkie.runtime.ChannelRegistry;
import io.walkie.runtime.ControlException;
import io.walkie.runtime.PendingRead;
import io.walkie.runtime.WalkieDaemon;
import io.walkie.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Executes control requests against a daemon. Runs on the daemon's event loop. Every
 * request gets exactly one reply; failures become {@code {"ok":false,"error":...}}.
 */
public final class IpcDispatcher {
    private final WalkieDaemon daemon;
    private final Runnable stopAction;

    public IpcDispatcher(WalkieDaemon daemon, Runnable stopAction) {
        this.daemon = daemon;
        this.stopAction = stopAction;
    }

    public void dispatch(JsonNode request, ClientHandle client) {
        try {
            execute(request, client);
        } catch (RuntimeException e) {
            client.reply(error(e));
        }
    }

    private void execute(JsonNode request, ClientHandle client) {
        if (request == null || !request.isObject()) {
            throw ControlException.badRequest("Request must be a JSON object");
        }
        JsonNode actionNode = request.get("action");
        String action = actionNode == null || actionNode.isNull() ? null : actionNode.asText();
        if (action == null) {
            throw ControlException.unknownAction(null);
        }
        switch (action) {
            case "join" -> join(request, client);
            case "send" -> send(request, client);
            case "read" -> read(request, client);
            case "leave" -> leave(request, client);
            case "status" -> client.reply(status());
            case "ping" -> client.reply(ok());
            case "stop" -> {
                client.reply(ok());
                stopAction.run();
            }
            default -> throw ControlException.unknownAction(action);
        }
    }

    private void join(JsonNode request, ClientHandle client) {
        String channel = requireText(request, "channel");
        String secret = requireText(request, "secret");
        daemon.channels().join(channel, secret).whenComplete((joined, error) -> {
            if (error != null) {
                client.reply(error(error));
            } else {
                client.reply(ok().put("channel", channel));
            }
        });
    }

    private void send(JsonNode request, ClientHandle client) {
        JsonNode message = request.get("message");
        int maxBytes = daemon.settings().maxMessageBytes();
        // Size first, so an oversized request is refused before any channel lookup.
        if (message != null && message.isTextual()
                && message.asText().getBytes(StandardCharsets.UTF_8).length > maxBytes) {
            throw ControlException.messageTooLarge(maxBytes);
        }
        String channel = requireText(request, "channel");
        if (message == null || !message.isTextual()) {
            throw ControlException.badRequest("Missing string field: message");
        }
        int delivered = daemon.router().send(channel, message.asText());
        client.reply(ok().put("delivered", delivered));
    }

    private void read(JsonNode request, ClientHandle client) {
        String channel = requireText(request, "channel");
        boolean wait = request.path("wait").asBoolean(false);
        PendingRead read = daemon.channels().read(channel, wait, timeoutOf(request), client::isOpen);
        if (!read.isDone()) {
            client.track(read);
        }
        read.result().thenAccept(messages -> {
            if (client.isOpen()) {
                client.reply(messages(messages));
            }
        });
    }

    private void leave(JsonNode request, ClientHandle client) {
        String channel = requireText(request, "channel");
        daemon.channels().leave(channel).whenComplete((ignored, error) -> {
            if (error != null) {
                client.reply(error(error));
            } else {
                client.reply(ok());
            }
        });
    }

    private ObjectNode status() {
        ObjectNode channels = Jsons.mapper().createObjectNode();
        for (Map.Entry<String, ChannelRegistry.ChannelStatus> entry : daemon.channels().status().entrySet()) {
            channels.set(entry.getKey(), Jsons.mapper().valueToTree(entry.getValue()));
        }
        ObjectNode out = ok();
        out.set("channels", channels);
        out.put("daemonId", daemon.instanceId());
        return out;
    }

    private Duration timeoutOf(JsonNode request) {
        double seconds = request.path("timeout").asDouble(0.0);
        if (seconds <= 0.0 || Double.isNaN(seconds)) {
            return Duration.ofMillis(daemon.settings().defaultReadTimeoutMs());
        }
        return Duration.ofMillis(Math.round(seconds * 1000.0));
    }

    private static String requireText(JsonNode request, String field) {
        JsonNode node = request.get(field);
        if (node == null || !node.isValueNode() || node.isNull()) {
            throw ControlException.badRequest("Missing string field: " + field);
        }
        return node.asText();
    }

    static ObjectNode ok() {
        return Jsons.mapper().createObjectNode().put("ok", true);
    }

    static ObjectNode messages(List<MessageEntry> messages) {
        ObjectNode out = ok();
        out.set("messages", Jsons.mapper().valueToTree(messages));
        return out;
    }

    static ObjectNode error(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return error(message);
    }

    static ObjectNode error(String message) {
        return Jsons.mapper().createObjectNode().put("ok", false).put("error", message);
    }
}
