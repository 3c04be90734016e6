package br.edu.ifba.hybridrag.storage.impl;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Timestamps are stored as fixed-width ISO-8601 UTC text with millisecond precision,
 * the same format the schema defaults produce, so they sort lexicographically.
 */
final class SQLiteTimestamps {

    private static final DateTimeFormatter FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private SQLiteTimestamps() {
        throw new UnsupportedOperationException("Utility class");
    }

    static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    static String now() {
        return format(Instant.now());
    }

    static Instant parse(String value) {
        return value == null ? null : Instant.parse(value);
    }
}
