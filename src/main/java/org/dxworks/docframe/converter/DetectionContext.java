package org.dxworks.docframe.converter;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;

/**
 * What a {@link ContentDetector} may look at: the bounded content prefix, the path when the
 * input is a file, and the whole content when the input already sits in memory.
 */
public final class DetectionContext {

    private final byte[] prefix;
    private final Path path;
    private final String filename;
    private final byte[] content;

    public DetectionContext(byte[] prefix, Path path, String filename) {
        this(prefix, path, filename, null);
    }

    public DetectionContext(byte[] prefix, Path path, String filename, byte[] content) {
        this.prefix = prefix;
        this.path = path;
        this.filename = filename;
        this.content = content;
    }

    public static DetectionContext ofPrefix(byte[] prefix) {
        return new DetectionContext(prefix, null, null);
    }

    /** Context for content held in memory; the prefix is its first {@code prefixLimit} bytes. */
    public static DetectionContext ofContent(byte[] content, int prefixLimit) {
        return new DetectionContext(Arrays.copyOf(content, Math.min(prefixLimit, content.length)), null, null, content);
    }

    public byte[] prefix() {
        return prefix;
    }

    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    public Optional<String> filename() {
        return Optional.ofNullable(filename);
    }

    /**
     * The complete content for in-memory inputs. Detectors must treat it as read-only.
     */
    public Optional<byte[]> content() {
        return Optional.ofNullable(content);
    }

    public boolean startsWith(byte[] pattern, int offset) {
        return new MagicBytes(pattern, offset).matches(prefix);
    }

    /** The prefix decoded as UTF-8; truncated multi-byte sequences decode to replacement characters. */
    public String prefixAsText() {
        return new String(prefix, StandardCharsets.UTF_8);
    }
}
