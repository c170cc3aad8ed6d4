package dev.rxcache.error;

/**
 * Every attempt of a remote call failed. The individual attempt failures are attached
 * as suppressed exceptions.
 */
public class RemoteUnavailableException extends RxCacheException {
    private final int attempts;

    public RemoteUnavailableException(String requestKey, int attempts, Throwable lastFailure) {
        super("No response for [" + requestKey + "] after " + attempts + " attempts", lastFailure);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
