package dev.rxcache.error;

public class StoreUnavailableException extends RxCacheException {
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
