package io.walkie.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Fixed-length mesh topic identifier. Compared by content; rendered as lowercase hex
 * on the peer wire.
 */
public final class Topic {
    public static final int LENGTH = 32;

    private final byte[] bytes;
    private final String hex;

    public Topic(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("topic must be " + LENGTH + " bytes");
        }
        this.bytes = bytes.clone();
        this.hex = HexFormat.of().formatHex(bytes);
    }

    public static Topic fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("topic hex must be " + (LENGTH * 2) + " chars");
        }
        return new Topic(HexFormat.of().parseHex(hex.toLowerCase()));
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    public String hex() {
        return hex;
    }

    public String shortHex() {
        return hex.substring(0, 16);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Topic other && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return shortHex();
    }
}
