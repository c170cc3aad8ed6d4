package dev.rxcache.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.rxcache.channel.CacheWriteChannel;
import dev.rxcache.channel.Message;
import dev.rxcache.config.CacheBuildConfig;
import dev.rxcache.error.NotCachedException;
import dev.rxcache.error.PayloadFormatException;
import dev.rxcache.error.RemoteRequestException;
import dev.rxcache.error.RemoteUnavailableException;
import dev.rxcache.store.AccessMode;
import dev.rxcache.store.CacheStore;
import dev.rxcache.testing.FakeRemoteService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RemoteClientTest {

    private static final RequestKeys KEYS = RequestKeys.defaults();
    private static final String KEY = KEYS.allRelated(161);

    private Path tmp;
    private CacheStore snapshot;
    private final CacheWriteChannel channel = new CacheWriteChannel();
    private final FakeRemoteService service = new FakeRemoteService();
    private final CacheBuildConfig config = new CacheBuildConfig()
            .setRetryDelay(Duration.ZERO)
            .setFailIfNotCached(false);

    @BeforeEach
    void setUp() throws Exception {
        tmp = Files.createTempDirectory("rxcache-client-");
        Path cache = tmp.resolve("rxcui.cache");
        try (CacheStore w = CacheStore.open(cache, AccessMode.APPEND)) {
            w.loadIndex();
            w.append(KEYS.historicalConcept(161), "{\"cached\":true}");
        }
        snapshot = CacheStore.open(cache, AccessMode.READ_ONLY);
        snapshot.loadIndex();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (snapshot != null) snapshot.close();
        if (tmp != null) {
            try {
                Files.walk(tmp)
                        .sorted((a, b) -> b.getNameCount() - a.getNameCount())
                        .forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignored) {} });
            } catch (Exception ignored) {}
        }
    }

    private RemoteClient client() {
        return new RemoteClient(service, snapshot, channel, config);
    }

    @Test
    void cacheHitDoesNotCallRemote() {
        RemoteClient client = client();
        JsonNode node = client.fetch(KEYS.historicalConcept(161));

        assertTrue(node.path("cached").asBoolean());
        assertEquals(0, service.totalCalls());
        assertEquals(0, channel.sentCount());
        assertEquals(new ClientStats(1, 0, 1, 0), client.stats());
    }

    @Test
    void remoteResultIsForwardedToWriter() throws Exception {
        service.respond(KEY, "{\"allRelatedGroup\":{}}");
        RemoteClient client = client();

        assertEquals("{\"allRelatedGroup\":{}}", client.fetchText(KEY));
        assertEquals(1, channel.sentCount());
        assertEquals(Message.cacheWrite(KEY, "{\"allRelatedGroup\":{}}"), channel.receive());
        assertEquals(new ClientStats(1, 1, 0, 0), client.stats());
    }

    @Test
    void succeedsAfterTransientFailures() {
        service.respond(KEY, "{}").failTimes(KEY, 3);
        RemoteClient client = client();

        client.fetch(KEY);

        assertEquals(4, service.callsFor(KEY));
        assertEquals(1, channel.sentCount());
        assertEquals(3, client.stats().failedAttempts());
    }

    @Test
    void givesUpAfterConfiguredAttemptsWithoutForwarding() {
        service.respond(KEY, "{}").failTimes(KEY, 1_000);
        RemoteClient client = client();

        RemoteUnavailableException ex = assertThrows(RemoteUnavailableException.class, () -> client.fetch(KEY));

        assertEquals(40, service.callsFor(KEY));
        assertEquals(40, ex.getAttempts());
        assertEquals(39, ex.getSuppressed().length);
        assertNotNull(ex.getCause());
        assertEquals(0, channel.sentCount());
    }

    @Test
    void nonRetryableStatusIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        RemoteService rejecting = key -> {
            calls.incrementAndGet();
            throw new RemoteRequestException(key, 404);
        };
        RemoteClient client = new RemoteClient(rejecting, snapshot, channel, config);

        RemoteRequestException ex = assertThrows(RemoteRequestException.class, () -> client.fetch(KEY));
        assertEquals(404, ex.getStatusCode());
        assertEquals(1, calls.get());
        assertEquals(0, channel.sentCount());
    }

    @Test
    void cacheOnlyModeRaisesNotCached() {
        config.setFailIfNotCached(true);
        RemoteClient client = new RemoteClient(null, snapshot, null, config);

        NotCachedException ex = assertThrows(NotCachedException.class, () -> client.fetch(KEY));
        assertEquals(KEY, ex.getRequestKey());
        assertTrue(client.isCacheOnly());
        assertFalse(client.isForwarding());
        assertDoesNotThrow(() -> client.fetch(KEYS.historicalConcept(161)));
    }

    @Test
    void serviceIsRequiredUnlessCacheOnly() {
        assertThrows(IllegalArgumentException.class, () -> new RemoteClient(null, snapshot, channel, false, config));
    }

    @Test
    void lineBreaksInPayloadAreFlattenedBeforeForwarding() throws Exception {
        service.respond(KEY, "{\r\n  \"a\": 1,\n  \"b\": 2\r}");
        RemoteClient client = client();

        JsonNode node = client.fetch(KEY);

        assertEquals(2, node.path("b").asInt());
        Message.CacheWrite write = (Message.CacheWrite) channel.receive();
        assertFalse(write.payload().contains("\n"));
        assertFalse(write.payload().contains("\r"));
        assertEquals(1, new ObjectMapper().readTree(write.payload()).path("a").asInt());
    }

    @Test
    void unparseablePayloadIsNotForwarded() {
        service.respond(KEY, "<html>Service Unavailable</html>");
        RemoteClient client = client();

        assertThrows(PayloadFormatException.class, () -> client.fetch(KEY));
        assertEquals(0, channel.sentCount());
        assertEquals(1, client.stats().remoteCalls(), "the call reached the service and is counted");
        assertEquals(1, service.callsFor(KEY));
    }

    @Test
    void waitsConfiguredDelayBetweenAttempts() {
        service.respond(KEY, "{}").failTimes(KEY, 2);
        config.setRetryDelay(Duration.ofMillis(40));
        RemoteClient client = client();

        long started = System.nanoTime();
        client.fetch(KEY);
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

        assertEquals(3, service.callsFor(KEY));
        assertTrue(elapsedMillis >= 80, "two waits of 40 ms, took " + elapsedMillis + " ms");
    }

    @Test
    void singleAttemptConfigurationDoesNotRetry() {
        service.respond(KEY, "{}").failTimes(KEY, 1);
        config.setRetryAttempts(1);
        RemoteClient client = client();

        RemoteUnavailableException ex = assertThrows(RemoteUnavailableException.class, () -> client.fetch(KEY));
        assertEquals(1, ex.getAttempts());
        assertEquals(0, ex.getSuppressed().length);
        assertEquals(1, service.callsFor(KEY));
    }

    @Test
    void clientWithoutSnapshotAlwaysCallsRemote() {
        service.respond(KEYS.historicalConcept(161), "{}");
        RemoteClient client = new RemoteClient(service, null, null, config);

        client.fetch(KEYS.historicalConcept(161));
        client.fetch(KEYS.historicalConcept(161));

        assertEquals(2, service.totalCalls());
        assertEquals(0, client.snapshotSize());
    }
}
