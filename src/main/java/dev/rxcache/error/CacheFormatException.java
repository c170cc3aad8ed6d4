package dev.rxcache.error;

/**
 * The cache log does not decompose into whole, well-formed three-line records.
 */
public class CacheFormatException extends RxCacheException {
    public CacheFormatException(String message) {
        super(message);
    }
}
