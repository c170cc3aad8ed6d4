package dev.rxcache.pipeline;

import dev.rxcache.api.CacheQueries;
import dev.rxcache.remote.RemoteClient;
import dev.rxcache.store.CacheStore;

/**
 * A task's private view of the cache: a read-only store with its index loaded once, and a
 * forwarding client over it.
 */
public final class Snapshot implements AutoCloseable {
    private final CacheStore store;
    private final RemoteClient client;
    private final CacheQueries queries;

    Snapshot(CacheStore store, TaskContext context) {
        this.store = store;
        this.client = new RemoteClient(context.service(), store, context.channel(), context.config());
        this.queries = new CacheQueries(client, context.keys());
    }

    public RemoteClient client() {
        return client;
    }

    public CacheQueries queries() {
        return queries;
    }

    @Override
    public void close() {
        store.close();
    }
}
