package org.dxworks.docframe.ast;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view over the well-known keys of {@link Document#metadata}.
 * <p>
 * Dates are kept as ISO-8601 strings so the map stays serializable as-is.
 * Keys that are not well-known end up in {@link #custom}, which is stored under the
 * {@code custom} key as a nested map.
 */
public class DocumentMetadata {
    public static final String TITLE = "title";
    public static final String AUTHOR = "author";
    public static final String SUBJECT = "subject";
    public static final String CREATION_DATE = "creation_date";
    public static final String MODIFICATION_DATE = "modification_date";
    public static final String KEYWORDS = "keywords";
    public static final String LANGUAGE = "language";
    public static final String CUSTOM = "custom";

    public String title;
    public String author;
    public String subject;
    public String creationDate;
    public String modificationDate;
    public List<String> keywords = new ArrayList<>();
    public String language;
    public Map<String, Object> custom = new LinkedHashMap<>();

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, TITLE, title);
        putIfPresent(map, AUTHOR, author);
        putIfPresent(map, SUBJECT, subject);
        putIfPresent(map, CREATION_DATE, creationDate);
        putIfPresent(map, MODIFICATION_DATE, modificationDate);
        if (!keywords.isEmpty()) {
            map.put(KEYWORDS, new ArrayList<>(keywords));
        }
        putIfPresent(map, LANGUAGE, language);
        if (!custom.isEmpty()) {
            map.put(CUSTOM, new LinkedHashMap<>(custom));
        }
        return map;
    }

    public static DocumentMetadata fromMap(Map<String, Object> map) {
        DocumentMetadata metadata = new DocumentMetadata();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Object value = entry.getValue();
            switch (entry.getKey()) {
                case TITLE -> metadata.title = asString(value);
                case AUTHOR -> metadata.author = asString(value);
                case SUBJECT -> metadata.subject = asString(value);
                case CREATION_DATE -> metadata.creationDate = asString(value);
                case MODIFICATION_DATE -> metadata.modificationDate = asString(value);
                case LANGUAGE -> metadata.language = asString(value);
                case KEYWORDS -> metadata.keywords = asStringList(value);
                case CUSTOM -> {
                    if (value instanceof Map<?, ?> nested) {
                        nested.forEach((k, v) -> metadata.custom.put(String.valueOf(k), v));
                    } else {
                        metadata.custom.put(CUSTOM, value);
                    }
                }
                default -> metadata.custom.put(entry.getKey(), value);
            }
        }
        return metadata;
    }

    /**
     * Writes this metadata into {@code document}, replacing its metadata map.
     */
    public void applyTo(Document document) {
        document.metadata = toMap();
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Iterable<?> values) {
            for (Object v : values) {
                result.add(String.valueOf(v));
            }
        } else if (value != null) {
            for (String part : String.valueOf(value).split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
