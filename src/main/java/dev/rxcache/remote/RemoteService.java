package dev.rxcache.remote;

import java.io.IOException;

/**
 * Transport to the remote data service: one call per logical query.
 */
public interface RemoteService {
    /**
     * Performs the query encoded by {@code requestKey} and returns the response body.
     *
     * @throws IOException on a transient communication failure; the caller retries
     */
    String get(String requestKey) throws IOException;
}
