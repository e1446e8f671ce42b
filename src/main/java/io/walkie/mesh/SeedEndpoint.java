package io.walkie.mesh;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public record SeedEndpoint(String host, int port) {

    /** Parses {@code host:port} strings, skipping malformed entries and duplicates. */
    public static List<SeedEndpoint> parseAll(List<String> rawSeeds) {
        if (rawSeeds == null || rawSeeds.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<SeedEndpoint> out = new ArrayList<>();
        for (String seed : rawSeeds) {
            if (seed == null || seed.isBlank()) {
                continue;
            }
            String trimmed = seed.trim();
            int idx = trimmed.lastIndexOf(':');
            if (idx <= 0 || idx == trimmed.length() - 1) {
                continue;
            }
            String host = trimmed.substring(0, idx).trim();
            String portText = trimmed.substring(idx + 1).trim();
            if (host.isEmpty()) {
                continue;
            }
            try {
                int port = Integer.parseInt(portText);
                if (port <= 0 || port > 65535) {
                    continue;
                }
                if (seen.add(host.toLowerCase(Locale.ROOT) + ":" + port)) {
                    out.add(new SeedEndpoint(host, port));
                }
            } catch (NumberFormatException ignored) {
                // Not a port; skip this seed.
            }
        }
        return out;
    }
}
