package dev.rxcache.remote;

import dev.rxcache.config.CacheBuildConfig;
import dev.rxcache.error.RemoteRequestException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link RemoteService} over HTTP GET, where the request key is the full URL.
 *
 * <p>Throttling (429) and server errors (5xx) are reported as {@link IOException} so they are
 * retried like connection failures. Any other non-2xx status is a {@link RemoteRequestException}.
 */
public class HttpRemoteService implements RemoteService {
    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpRemoteService(CacheBuildConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(config.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = config.getRequestTimeout();
    }

    @Override
    public String get(String requestKey) throws IOException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(requestKey))
                .timeout(requestTimeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while requesting " + requestKey);
        }
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new IOException("HTTP " + status + " from " + requestKey);
        }
        if (status < 200 || status >= 300) {
            throw new RemoteRequestException(requestKey, status);
        }
        return response.body();
    }
}
