package org.dxworks.docframe.converter;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * One document to convert: a file, an in-memory buffer or a stream, plus optional
 * filename and MIME type hints.
 * <p>
 * {@link #readPrefix(int)} never consumes a stream: the stream is wrapped in a
 * {@link BufferedInputStream} and rewound after the peek, so parsers still see
 * the content from its first byte.
 */
public final class DocumentInput {

    private final Path path;
    private final byte[] bytes;
    private final InputStream stream;
    private final String filename;
    private final String mimeType;

    private DocumentInput(Path path, byte[] bytes, InputStream stream, String filename, String mimeType) {
        this.path = path;
        this.bytes = bytes;
        this.stream = stream;
        this.filename = filename;
        this.mimeType = mimeType;
    }

    public static DocumentInput of(Path path) {
        Objects.requireNonNull(path, "path");
        return new DocumentInput(path, null, null, null, null);
    }

    public static DocumentInput of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new DocumentInput(null, bytes, null, null, null);
    }

    public static DocumentInput of(InputStream stream) {
        Objects.requireNonNull(stream, "stream");
        InputStream markable = stream.markSupported() ? stream : new BufferedInputStream(stream);
        return new DocumentInput(null, null, markable, null, null);
    }

    public DocumentInput withFilename(String filename) {
        return new DocumentInput(path, bytes, stream, filename, mimeType);
    }

    public DocumentInput withMimeType(String mimeType) {
        return new DocumentInput(path, bytes, stream, filename, mimeType);
    }

    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }

    /**
     * The explicit filename hint, falling back to the file name of the path.
     */
    public Optional<String> filename() {
        if (filename != null) {
            return Optional.of(filename);
        }
        if (path != null && path.getFileName() != null) {
            return Optional.of(path.getFileName().toString());
        }
        return Optional.empty();
    }

    public Optional<String> mimeType() {
        return Optional.ofNullable(mimeType);
    }

    /** The in-memory buffer itself, without copying; empty for files and streams. */
    Optional<byte[]> buffer() {
        return Optional.ofNullable(bytes);
    }

    /**
     * Reads at most {@code limit} leading bytes without consuming the input.
     */
    public byte[] readPrefix(int limit) throws IOException {
        if (limit <= 0) {
            return new byte[0];
        }
        if (bytes != null) {
            return Arrays.copyOf(bytes, Math.min(limit, bytes.length));
        }
        if (path != null) {
            try (InputStream in = Files.newInputStream(path)) {
                return in.readNBytes(limit);
            }
        }
        synchronized (stream) {
            stream.mark(limit);
            try {
                return stream.readNBytes(limit);
            } finally {
                stream.reset();
            }
        }
    }

    /**
     * Opens the content from its start. For stream inputs this hands out the wrapped
     * stream itself, so it can be consumed only once.
     */
    public InputStream openStream() throws IOException {
        if (bytes != null) {
            return new ByteArrayInputStream(bytes);
        }
        if (path != null) {
            return Files.newInputStream(path);
        }
        return stream;
    }

    public byte[] readAllBytes() throws IOException {
        if (bytes != null) {
            return bytes.clone();
        }
        if (path != null) {
            return Files.readAllBytes(path);
        }
        return stream.readAllBytes();
    }

    public String readString(Charset charset) throws IOException {
        return new String(readAllBytes(), charset);
    }

    /**
     * Human-readable name used in error messages.
     */
    public String describe() {
        if (path != null) {
            return path.toString();
        }
        if (filename != null) {
            return filename;
        }
        return bytes != null ? "<bytes>" : "<stream>";
    }

    @Override
    public String toString() {
        return describe();
    }
}
