package dev.rxcache.error;

/**
 * Raised in cache-only mode when a request key is absent from the holder's snapshot.
 */
public class NotCachedException extends RxCacheException {
    private final String requestKey;

    public NotCachedException(String requestKey) {
        super("Not in cache: [" + requestKey + "]");
        this.requestKey = requestKey;
    }

    public String getRequestKey() {
        return requestKey;
    }
}
