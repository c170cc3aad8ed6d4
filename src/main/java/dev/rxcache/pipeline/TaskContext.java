package dev.rxcache.pipeline;

import dev.rxcache.channel.CacheWriteChannel;
import dev.rxcache.config.CacheBuildConfig;
import dev.rxcache.remote.RemoteService;
import dev.rxcache.remote.RequestKeys;
import dev.rxcache.store.AccessMode;
import dev.rxcache.store.CacheStore;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Objects;

/**
 * Immutable settings shared by every task of a run. Holds nothing mutable except the
 * channel, which is the only object tasks communicate through.
 */
public final class TaskContext {
    private final CacheBuildConfig config;
    private final RemoteService service;
    private final RequestKeys keys;
    private final CacheWriteChannel channel;
    private final Clock clock;

    public TaskContext(CacheBuildConfig config, RemoteService service, CacheWriteChannel channel, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.service = service;
        this.keys = new RequestKeys(config.getBaseUrl());
        this.channel = Objects.requireNonNull(channel, "channel cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Opens a read-only snapshot of the cache as it is right now, with a client that
     * forwards every remote result to the writer.
     */
    public Snapshot openSnapshot() {
        CacheStore store = openStore(AccessMode.READ_ONLY);
        try {
            store.loadIndex();
            return new Snapshot(store, this);
        } catch (RuntimeException e) {
            store.close();
            throw e;
        }
    }

    CacheStore openStore(AccessMode mode) {
        return CacheStore.open(cachePath(), mode, clock, config.getIndexProgressInterval());
    }

    public Path cachePath() {
        return Path.of(config.getCachePath());
    }

    public CacheBuildConfig config() {
        return config;
    }

    public RemoteService service() {
        return service;
    }

    public RequestKeys keys() {
        return keys;
    }

    public CacheWriteChannel channel() {
        return channel;
    }
}
