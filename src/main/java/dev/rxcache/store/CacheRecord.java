package dev.rxcache.store;

import java.util.Objects;

/**
 * One cached remote result as it appears in the log: three newline-terminated lines.
 *
 * @param key           request key (a REST URL) identifying the logical query
 * @param retrievalDate date the result was obtained, {@code yyyyMMdd}
 * @param payload       raw payload text returned by the service
 */
public record CacheRecord(String key, String retrievalDate, String payload) {
    public static final int DATE_LENGTH = 8;

    public CacheRecord {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(retrievalDate, "retrievalDate cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        requireSingleLine("key", key);
        requireSingleLine("payload", payload);
        if (retrievalDate.length() != DATE_LENGTH) {
            throw new IllegalArgumentException("retrievalDate must be exactly " + DATE_LENGTH + " characters, got '" + retrievalDate + "'");
        }
    }

    private static void requireSingleLine(String field, String value) {
        if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            throw new IllegalArgumentException(field + " must not contain line breaks");
        }
    }
}
