package org.dxworks.docframe.transform.builtin;

import org.dxworks.docframe.ast.Document;
import org.dxworks.docframe.ast.Node;
import org.dxworks.docframe.ast.NodeTransformer;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Records when the document was converted in its metadata. The format is {@code iso}
 * (ISO-8601 local date-time), {@code unix} (epoch seconds) or a {@link DateTimeFormatter} pattern.
 */
public class AddConversionTimestampTransform extends NodeTransformer {

    public static final String ISO = "iso";
    public static final String UNIX = "unix";

    private final String fieldName;
    private final String format;
    private final Clock clock;

    public AddConversionTimestampTransform(String fieldName, String format) {
        this(fieldName, format, Clock.systemDefaultZone());
    }

    /**
     * @throws IllegalArgumentException when {@code format} is neither a keyword nor a valid pattern
     */
    public AddConversionTimestampTransform(String fieldName, String format, Clock clock) {
        this.fieldName = fieldName;
        this.format = format;
        this.clock = clock;
        if (!ISO.equals(format) && !UNIX.equals(format)) {
            DateTimeFormatter.ofPattern(format);
        }
    }

    @Override
    public Node visit(Document document) {
        Document copy = (Document) super.visit(document);
        copy.metadata.put(fieldName, timestamp());
        return copy;
    }

    private String timestamp() {
        if (UNIX.equals(format)) {
            return String.valueOf(clock.instant().getEpochSecond());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (ISO.equals(format)) {
            return now.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        return now.format(DateTimeFormatter.ofPattern(format));
    }
}
