package dev.rxcache.error;

/**
 * The remote service answered with a status that retrying cannot fix (4xx other than 429).
 */
public class RemoteRequestException extends RxCacheException {
    private final int statusCode;

    public RemoteRequestException(String requestKey, int statusCode) {
        super("Request [" + requestKey + "] rejected with HTTP " + statusCode);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
