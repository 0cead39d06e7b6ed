package org.dxworks.docframe.converter.detect;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;
import org.dxworks.docframe.converter.ContentDetector;
import org.dxworks.docframe.converter.DetectionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Optional;

/**
 * Recognises zip based formats by their entries without inflating entry content.
 * <p>
 * Files and in-memory buffers are inspected through the central directory, so the entry order
 * does not matter. Streamed input only exposes the local file headers inside the detection prefix;
 * there a stored {@code mimetype} entry (ODF, EPUB) or an early entry of the expected directory
 * is what decides.
 */
public final class ZipEntryDetector implements ContentDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ZipEntryDetector.class);

    private static final int LOCAL_HEADER_SIGNATURE = 0x04034b50;
    private static final int LOCAL_HEADER_LENGTH = 30;
    private static final int STORED = 0;
    private static final int DATA_DESCRIPTOR_FLAG = 0x08;
    private static final String MIMETYPE_ENTRY = "mimetype";
    private static final int MAX_MIMETYPE_LENGTH = 256;

    private final String entryPrefix;
    private final String mimetype;

    private ZipEntryDetector(String entryPrefix, String mimetype) {
        this.entryPrefix = entryPrefix;
        this.mimetype = mimetype;
    }

    /**
     * Matches archives with an entry whose name starts with {@code entryPrefix}, e.g. {@code "word/"}.
     */
    public static ZipEntryDetector containingEntry(String entryPrefix) {
        return new ZipEntryDetector(entryPrefix, null);
    }

    /**
     * Matches archives whose {@code mimetype} entry holds exactly {@code mimetype}.
     */
    public static ZipEntryDetector withMimetype(String mimetype) {
        return new ZipEntryDetector(null, mimetype);
    }

    @Override
    public boolean matches(DetectionContext context) throws IOException {
        Optional<Path> path = context.path();
        if (path.isPresent()) {
            try (ZipFile zip = ZipFile.builder().setPath(path.get()).get()) {
                return matchesCentralDirectory(zip);
            }
        }
        Optional<byte[]> content = context.content();
        if (content.isPresent()) {
            try (ZipFile zip = ZipFile.builder().setSeekableByteChannel(new SeekableInMemoryByteChannel(content.get())).get()) {
                return matchesCentralDirectory(zip);
            } catch (IOException e) {
                LOG.debug("No readable central directory in memory, falling back to local headers: {}", e.getMessage());
            }
        }
        return matchesLocalHeaders(context.prefix());
    }

    private boolean matchesCentralDirectory(ZipFile zip) throws IOException {
        if (mimetype != null) {
            ZipArchiveEntry entry = zip.getEntry(MIMETYPE_ENTRY);
            if (entry == null) {
                return false;
            }
            try (InputStream in = zip.getInputStream(entry)) {
                String content = new String(in.readNBytes(MAX_MIMETYPE_LENGTH), StandardCharsets.US_ASCII).trim();
                return mimetype.equals(content);
            }
        }
        Enumeration<ZipArchiveEntry> entries = zip.getEntries();
        while (entries.hasMoreElements()) {
            if (entries.nextElement().getName().startsWith(entryPrefix)) {
                return true;
            }
        }
        return false;
    }

    private boolean matchesLocalHeaders(byte[] prefix) {
        List<LocalEntry> entries = scanLocalHeaders(prefix);
        if (mimetype != null) {
            return entries.stream()
                    .filter(entry -> MIMETYPE_ENTRY.equals(entry.name))
                    .anyMatch(entry -> mimetype.equals(entry.storedContent));
        }
        return entries.stream().anyMatch(entry -> entry.name.startsWith(entryPrefix));
    }

    /**
     * Entry names of the local headers that fit completely inside {@code prefix}.
     */
    public static List<String> listEntryNames(byte[] prefix) {
        List<String> names = new ArrayList<>();
        for (LocalEntry entry : scanLocalHeaders(prefix)) {
            names.add(entry.name);
        }
        return names;
    }

    private static List<LocalEntry> scanLocalHeaders(byte[] data) {
        List<LocalEntry> entries = new ArrayList<>();
        int position = 0;
        while (position + LOCAL_HEADER_LENGTH <= data.length && readInt(data, position) == LOCAL_HEADER_SIGNATURE) {
            int flags = readShort(data, position + 6);
            int method = readShort(data, position + 8);
            long compressedSize = readInt(data, position + 18) & 0xffffffffL;
            int nameLength = readShort(data, position + 26);
            int extraLength = readShort(data, position + 28);
            int nameStart = position + LOCAL_HEADER_LENGTH;
            if (nameStart + nameLength > data.length) {
                break;
            }
            String name = new String(data, nameStart, nameLength, StandardCharsets.UTF_8);
            long dataStart = (long) nameStart + nameLength + extraLength;

            String storedContent = null;
            if (method == STORED && MIMETYPE_ENTRY.equals(name) && compressedSize <= MAX_MIMETYPE_LENGTH
                    && dataStart + compressedSize <= data.length) {
                storedContent = new String(data, (int) dataStart, (int) compressedSize, StandardCharsets.US_ASCII).trim();
            }
            entries.add(new LocalEntry(name, storedContent));

            // sizes live in a trailing data descriptor, so the next header cannot be located
            if ((flags & DATA_DESCRIPTOR_FLAG) != 0 && compressedSize == 0) {
                break;
            }
            long next = dataStart + compressedSize;
            if (next > data.length) {
                break;
            }
            position = (int) next;
        }
        return entries;
    }

    private static int readShort(byte[] data, int offset) {
        return (data[offset] & 0xff) | (data[offset + 1] & 0xff) << 8;
    }

    private static int readInt(byte[] data, int offset) {
        return readShort(data, offset) | readShort(data, offset + 2) << 16;
    }

    private static final class LocalEntry {
        final String name;
        final String storedContent;

        LocalEntry(String name, String storedContent) {
            this.name = name;
            this.storedContent = storedContent;
        }
    }

    @Override
    public String toString() {
        return mimetype != null ? "zip mimetype " + mimetype : "zip entry " + entryPrefix + "*";
    }
}
