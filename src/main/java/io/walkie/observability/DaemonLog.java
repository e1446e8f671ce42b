package io.walkie.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.walkie.security.SensitiveDataMasker;
import io.walkie.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSON-lines log for the daemon. Each line is
 * {@code {"timestamp","instance","event","details"}}; details are masked before
 * they are written. A null path gives a log that drops everything.
 */
public final class DaemonLog {
    private final Path logFile;
    private final String instanceId;
    private boolean failureReported;

    public DaemonLog(Path logFile, String instanceId) {
        this.logFile = logFile;
        this.instanceId = instanceId;
    }

    public static DaemonLog discarding() {
        return new DaemonLog(null, "");
    }

    public void log(String event) {
        log(event, Map.of());
    }

    public synchronized void log(String event, Map<String, Object> details) {
        if (logFile == null) {
            return;
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("instance", instanceId);
        row.put("event", event);
        row.put("details", sanitizeDetails(details));
        String line = Jsons.toLine(row) + System.lineSeparator();
        try {
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            if (!failureReported) {
                failureReported = true;
                System.err.println("WARN daemon log write failed: " + logFile + ": " + e.getMessage());
            }
        }
    }

    public Path logFile() {
        return logFile;
    }

    private static JsonNode sanitizeDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(details));
    }
}
