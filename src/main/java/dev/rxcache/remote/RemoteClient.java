package dev.rxcache.remote;

import com.fasterxml.jackson.databind.JsonNode;
import dev.rxcache.channel.CacheWriteChannel;
import dev.rxcache.channel.Message;
import dev.rxcache.config.CacheBuildConfig;
import dev.rxcache.error.NotCachedException;
import dev.rxcache.error.RemoteUnavailableException;
import dev.rxcache.ser.JsonPayloadParser;
import dev.rxcache.ser.PayloadParser;
import dev.rxcache.store.CacheStore;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Cache-or-remote fetch of a single logical query.
 *
 * <p>A request key already present in the holder's snapshot index is answered from the
 * cache file without touching the network. Otherwise the remote service is called through a
 * Resilience4j {@link Retry} that retries {@link IOException}s up to {@code retryAttempts}
 * times, {@code retryDelay} apart; any other failure is not retried. A successful result
 * is handed to the cache writer through the forwarding channel (when one is configured);
 * this client never writes the cache itself.
 *
 * <p>Counters and the rolling timing window are per instance. Each task builds its own
 * client, so nothing here is shared between tasks.
 *
 * <p><strong>Thread Safety:</strong> not thread-safe; owned by one task.
 */
public class RemoteClient {
    private static final Logger logger = LoggerFactory.getLogger(RemoteClient.class);

    private static final int TIMINGS_PER_LINE = 20;
    private static final String RETRY_NAME = "rxnav-remote";

    private final RemoteService service;
    private final CacheStore snapshot;
    private final CacheWriteChannel forwardTo;
    private final boolean cacheOnly;
    private final PayloadParser parser;
    private final int retryAttempts;
    private final Retry retry;
    private final int statsInterval;

    private final long startNanos = System.nanoTime();
    private final Deque<Long> timingWindow;
    private long requestCount;
    private long remoteCallCount;
    private long cacheHits;
    private long failedAttempts;
    private long lastSummaryNanos = startNanos;
    private long lastSummaryRemoteCalls;

    /**
     * Creates a client using the configured strict-mode flag.
     *
     * @see #RemoteClient(RemoteService, CacheStore, CacheWriteChannel, boolean, CacheBuildConfig)
     */
    public RemoteClient(RemoteService service, CacheStore snapshot, CacheWriteChannel forwardTo, CacheBuildConfig config) {
        this(service, snapshot, forwardTo, config.isFailIfNotCached(), config);
    }

    /**
     * @param service   transport used on a cache miss; may be null only when {@code cacheOnly}
     * @param snapshot  store whose index has been loaded; null disables caching
     * @param forwardTo channel that receives every remotely obtained result; null disables forwarding
     * @param cacheOnly when true a miss raises {@link NotCachedException} instead of calling the service
     * @param config    retry and statistics settings
     */
    public RemoteClient(RemoteService service,
                        CacheStore snapshot,
                        CacheWriteChannel forwardTo,
                        boolean cacheOnly,
                        CacheBuildConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        if (service == null && !cacheOnly) {
            throw new IllegalArgumentException("service is required unless the client is cache-only");
        }
        if (config.getRetryAttempts() < 1) {
            throw new IllegalArgumentException("retryAttempts must be at least 1, got " + config.getRetryAttempts());
        }
        this.service = service;
        this.snapshot = snapshot;
        this.forwardTo = forwardTo;
        this.cacheOnly = cacheOnly;
        this.parser = new JsonPayloadParser();
        this.retryAttempts = config.getRetryAttempts();
        Duration delay = config.getRetryDelay().isNegative() ? Duration.ZERO : config.getRetryDelay();
        this.retry = Retry.of(RETRY_NAME, RetryConfig.custom()
                .maxAttempts(retryAttempts)
                .waitDuration(delay)
                .retryExceptions(IOException.class)
                .build());
        this.retry.getEventPublisher().onRetry(this::onRetry);
        this.statsInterval = Math.max(1, config.getStatsInterval());
        this.timingWindow = new ArrayDeque<>(statsInterval);
    }

    /**
     * Fetches and parses the result for {@code requestKey}.
     *
     * @throws NotCachedException         in cache-only mode when the key is not in the snapshot
     * @throws RemoteUnavailableException when every remote attempt failed
     */
    public JsonNode fetch(String requestKey) {
        Fetched fetched = fetchInternal(requestKey);
        return fetched.parsed != null ? fetched.parsed : parser.parse(fetched.text);
    }

    /**
     * Same as {@link #fetch(String)} but returns the payload text unparsed.
     */
    public String fetchText(String requestKey) {
        return fetchInternal(requestKey).text;
    }

    private Fetched fetchInternal(String requestKey) {
        Objects.requireNonNull(requestKey, "requestKey cannot be null");
        requestCount++;

        if (snapshot != null) {
            Optional<String> cached = snapshot.lookup(requestKey);
            if (cached.isPresent()) {
                cacheHits++;
                return new Fetched(cached.get(), null);
            }
        }
        if (cacheOnly) {
            throw new NotCachedException(requestKey);
        }

        long started = System.nanoTime();
        String text = singleLine(callWithRetry(requestKey));
        remoteCallCount++;
        recordTiming(System.nanoTime() - started);
        JsonNode parsed = parser.parse(text); // unparseable results are never forwarded

        if (forwardTo != null) {
            forwardTo.send(Message.cacheWrite(requestKey, text));
        }
        return new Fetched(text, parsed);
    }

    private String callWithRetry(String requestKey) {
        List<IOException> failures = new ArrayList<>();
        CheckedSupplier<String> attempt = Retry.decorateCheckedSupplier(retry, () -> {
            try {
                return service.get(requestKey);
            } catch (IOException e) {
                failedAttempts++;
                failures.add(e);
                throw e;
            }
        });
        try {
            return attempt.get();
        } catch (IOException e) {
            logger.warn("Communication error with remote service, attempt {} of {}: {}",
                    failures.size(), retryAttempts, e.toString());
            throw unavailable(requestKey, failures);
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new RemoteUnavailableException(requestKey, failures.size(), t);
        }
    }

    private void onRetry(RetryOnRetryEvent event) {
        logger.warn("Communication error with remote service, attempt {} of {}, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), retryAttempts, event.getWaitInterval().toMillis(),
                String.valueOf(event.getLastThrowable()));
        logger.warn("Remote calls so far: {}, seconds since start: {}", remoteCallCount, secondsSince(startNanos));
    }

    private static RemoteUnavailableException unavailable(String requestKey, List<IOException> failures) {
        int attempts = failures.size();
        IOException last = failures.isEmpty() ? null : failures.get(attempts - 1);
        RemoteUnavailableException ex = new RemoteUnavailableException(requestKey, attempts, last);
        for (int i = 0; i < failures.size() - 1; i++) {
            ex.addSuppressed(failures.get(i));
        }
        logger.error("Giving up on [{}] after {} attempt(s)", requestKey, attempts);
        return ex;
    }

    private void recordTiming(long nanos) {
        if (timingWindow.size() == statsInterval) {
            timingWindow.removeFirst();
        }
        timingWindow.addLast(nanos);
        if (remoteCallCount % statsInterval != 0) {
            return;
        }
        if (remoteCallCount == statsInterval && logger.isDebugEnabled()) {
            logger.debug("Timings of first {} remote calls (seconds):", statsInterval);
            List<Long> timings = new ArrayList<>(timingWindow);
            for (int i = 0; i < timings.size(); i += TIMINGS_PER_LINE) {
                StringBuilder line = new StringBuilder("[");
                for (int j = i; j < Math.min(i + TIMINGS_PER_LINE, timings.size()); j++) {
                    if (j > i) line.append(", ");
                    line.append(String.format("%.3f", timings.get(j) / 1e9));
                }
                logger.debug(line.append(']').toString());
            }
        }
        long batch = remoteCallCount - lastSummaryRemoteCalls;
        long windowNanos = 0;
        for (long t : timingWindow) windowNanos += t;
        double seconds = secondsSince(lastSummaryNanos);
        logger.info("Sum of request timings of last batch of {} ==> {} seconds", batch, String.format("%.3f", windowNanos / 1e9));
        logger.info("Requests: {}, remote calls: {}, seconds: {}, rate/sec: {}, cache (size: {}, hits: {})",
                requestCount, remoteCallCount, String.format("%.3f", seconds),
                String.format("%.3f", seconds > 0 ? batch / seconds : 0.0),
                snapshot == null ? 0 : snapshot.index().size(), cacheHits);
        lastSummaryNanos = System.nanoTime();
        lastSummaryRemoteCalls = remoteCallCount;
    }

    // Raw line breaks are insignificant whitespace in JSON; removing them keeps the record on one line.
    private static String singleLine(String text) {
        if (text.indexOf('\n') < 0 && text.indexOf('\r') < 0) {
            return text;
        }
        return text.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
    }

    private static double secondsSince(long nanos) {
        return (System.nanoTime() - nanos) / 1e9;
    }

    public ClientStats stats() {
        return new ClientStats(requestCount, remoteCallCount, cacheHits, failedAttempts);
    }

    public boolean isCacheOnly() {
        return cacheOnly;
    }

    public boolean isForwarding() {
        return forwardTo != null;
    }

    public int snapshotSize() {
        return snapshot == null ? 0 : snapshot.index().size();
    }

    private record Fetched(String text, JsonNode parsed) {
    }
}
