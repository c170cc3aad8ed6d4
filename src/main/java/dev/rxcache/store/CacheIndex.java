package dev.rxcache.store;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory map of request key to record location. Payloads are never held in memory;
 * they are re-read from the log on a hit.
 *
 * <p>Not thread-safe: each holder owns its own index.
 */
public final class CacheIndex {
    private final Map<String, IndexEntry> entries = new HashMap<>();

    /**
     * Records the location of {@code key}, replacing any earlier location (last write wins).
     */
    void put(String key, IndexEntry entry) {
        entries.put(key, entry);
    }

    public Optional<IndexEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
