package dev.rxcache.remote;

/**
 * Point-in-time copy of a {@link RemoteClient}'s counters.
 *
 * @param requests    logical fetches, whether answered from cache or remotely
 * @param remoteCalls successful remote calls
 * @param cacheHits   fetches answered from the snapshot
 * @param failedAttempts remote attempts that failed and were retried or gave up
 */
public record ClientStats(long requests, long remoteCalls, long cacheHits, long failedAttempts) {
}
