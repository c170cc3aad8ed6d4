package dev.rxcache.error;

/**
 * Base type for every failure raised by the cache builder.
 *
 * <p>All subtypes are unchecked. Transient network faults never surface as one of these
 * until the retry budget is spent; everything else (corrupt cache, strict-mode miss,
 * unparseable payload) propagates and terminates the owning task.
 */
public class RxCacheException extends RuntimeException {
    public RxCacheException(String message) {
        super(message);
    }

    public RxCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
