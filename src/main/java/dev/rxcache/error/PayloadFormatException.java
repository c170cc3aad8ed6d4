package dev.rxcache.error;

public class PayloadFormatException extends RxCacheException {
    public PayloadFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
