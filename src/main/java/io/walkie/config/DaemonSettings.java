package io.walkie.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.walkie.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Daemon tunables. Values come from {@code walkie-settings.json} in the daemon
 * directory when present; anything missing or out of range keeps its default.
 */
public record DaemonSettings(
        int maxIpcBufferBytes,
        int maxPeerBufferBytes,
        int maxMessageBytes,
        long defaultReadTimeoutMs,
        int meshPort,
        int discoveryPort,
        long announceIntervalMs,
        List<String> seeds
) {
    public static final int DEFAULT_MAX_IPC_BUFFER_BYTES = 1024 * 1024;
    public static final int DEFAULT_MAX_PEER_BUFFER_BYTES = 1024 * 1024;
    public static final int DEFAULT_MAX_MESSAGE_BYTES = 256 * 1024;
    public static final long DEFAULT_READ_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_MESH_PORT = 17890;
    public static final int DEFAULT_DISCOVERY_PORT = 17891;
    public static final long DEFAULT_ANNOUNCE_INTERVAL_MS = 1_000L;

    public DaemonSettings {
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
    }

    public static DaemonSettings defaults() {
        return new DaemonSettings(
                DEFAULT_MAX_IPC_BUFFER_BYTES,
                DEFAULT_MAX_PEER_BUFFER_BYTES,
                DEFAULT_MAX_MESSAGE_BYTES,
                DEFAULT_READ_TIMEOUT_MS,
                DEFAULT_MESH_PORT,
                DEFAULT_DISCOVERY_PORT,
                DEFAULT_ANNOUNCE_INTERVAL_MS,
                List.of("255.255.255.255:" + DEFAULT_DISCOVERY_PORT)
        );
    }

    public static DaemonSettings load(Path file) {
        DaemonSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load daemon settings: " + file, e);
        }
    }

    static DaemonSettings fromFile(SettingsFile file, DaemonSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int maxMessage = sanitizeInt(file.maxMessageBytes(), defaults.maxMessageBytes(), 1);
        // A single maximal message must always fit in the buffers that carry it.
        int maxPeer = Math.max(sanitizeInt(file.maxPeerBufferBytes(), defaults.maxPeerBufferBytes(), 1024), maxMessage);
        int maxIpc = Math.max(sanitizeInt(file.maxIpcBufferBytes(), defaults.maxIpcBufferBytes(), 1024), maxMessage);
        List<String> seeds = new ArrayList<>();
        if (file.seeds() != null) {
            for (String seed : file.seeds()) {
                if (seed != null && !seed.isBlank()) {
                    seeds.add(seed.trim());
                }
            }
        }
        return new DaemonSettings(
                maxIpc,
                maxPeer,
                maxMessage,
                sanitizeLong(file.defaultReadTimeoutMs(), defaults.defaultReadTimeoutMs(), 1L),
                sanitizePort(file.meshPort(), defaults.meshPort()),
                sanitizePort(file.discoveryPort(), defaults.discoveryPort()),
                sanitizeLong(file.announceIntervalMs(), defaults.announceIntervalMs(), 100L),
                seeds.isEmpty() ? defaults.seeds() : seeds
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null || value < min) {
            return fallback;
        }
        return value;
    }

    private static int sanitizePort(Integer value, int fallback) {
        if (value == null || value <= 0 || value > 65535) {
            return fallback;
        }
        return value;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Integer maxIpcBufferBytes,
            Integer maxPeerBufferBytes,
            Integer maxMessageBytes,
            Long defaultReadTimeoutMs,
            Integer meshPort,
            Integer discoveryPort,
            Long announceIntervalMs,
            List<String> seeds
    ) {
    }
}
