package org.dxworks.docframe.converter;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A byte signature expected at a fixed offset of the content.
 */
public final class MagicBytes {

    private final byte[] pattern;
    private final int offset;

    public MagicBytes(byte[] pattern, int offset) {
        if (pattern == null || pattern.length == 0) {
            throw new IllegalArgumentException("Magic byte pattern must not be empty");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Magic byte offset must not be negative, got " + offset);
        }
        this.pattern = pattern.clone();
        this.offset = offset;
    }

    public static MagicBytes of(byte[] pattern) {
        return new MagicBytes(pattern, 0);
    }

    public static MagicBytes ascii(String pattern) {
        return new MagicBytes(pattern.getBytes(StandardCharsets.ISO_8859_1), 0);
    }

    public static MagicBytes ascii(String pattern, int offset) {
        return new MagicBytes(pattern.getBytes(StandardCharsets.ISO_8859_1), offset);
    }

    public byte[] getPattern() {
        return pattern.clone();
    }

    public int getOffset() {
        return offset;
    }

    /** Number of leading bytes needed to test this signature. */
    public int span() {
        return offset + pattern.length;
    }

    public boolean matches(byte[] prefix) {
        if (prefix.length < span()) {
            return false;
        }
        for (int i = 0; i < pattern.length; i++) {
            if (prefix[offset + i] != pattern[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MagicBytes other)) return false;
        return offset == other.offset && Arrays.equals(pattern, other.pattern);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(pattern) + offset;
    }

    @Override
    public String toString() {
        StringBuilder hex = new StringBuilder();
        for (byte b : pattern) {
            hex.append(String.format("%02x", b));
        }
        return hex + "@" + offset;
    }
}
