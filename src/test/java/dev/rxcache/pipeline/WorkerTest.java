package dev.rxcache.pipeline;

import dev.rxcache.channel.CacheWriteChannel;
import dev.rxcache.config.CacheBuildConfig;
import dev.rxcache.error.RemoteUnavailableException;
import dev.rxcache.error.StoreUnavailableException;
import dev.rxcache.remote.RequestKeys;
import dev.rxcache.store.AccessMode;
import dev.rxcache.store.CacheStore;
import dev.rxcache.testing.FakeRemoteService;
import dev.rxcache.testing.MutableClock;
import dev.rxcache.testing.RxNavFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static dev.rxcache.testing.RxNavFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class WorkerTest {

    private final RequestKeys keys = RequestKeys.defaults();
    private final FakeRemoteService service = RxNavFixtures.install(new FakeRemoteService(), keys);
    private final CacheWriteChannel channel = new CacheWriteChannel();

    private Path tmp;
    private Path cache;
    private CacheBuildConfig config;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws Exception {
        tmp = Files.createTempDirectory("rxcache-worker-");
        cache = tmp.resolve("rxcui.cache");
        config = new CacheBuildConfig()
                .setCachePath(cache.toString())
                .setRetryAttempts(3)
                .setRetryDelay(Duration.ZERO)
                .setWorkerProgressInterval(1);
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (executor != null) executor.shutdownNow();
        if (tmp != null) {
            try {
                Files.walk(tmp)
                        .sorted((a, b) -> b.getNameCount() - a.getNameCount())
                        .forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignored) {} });
            } catch (Exception ignored) {}
        }
    }

    private TaskContext context() {
        return new TaskContext(config, service, channel, MutableClock.onDate(2024, 3, 1));
    }

    private Segment segment(int... codes) {
        List<Integer> list = new ArrayList<>();
        for (int c : codes) list.add(c);
        return new Segment(1, WorkItem.of(list, EnumSet.of(Operation.HISTORICAL_STATUS, Operation.ALL_RELATED)));
    }

    private void createCache() {
        CacheStore.open(cache, AccessMode.APPEND).close();
    }

    private static void awaitWaiting(CyclicBarrier barrier, int parties) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (barrier.getNumberWaiting() < parties) {
            if (System.nanoTime() > deadline) fail("timed out waiting for " + parties + " parties at the barrier");
            Thread.sleep(5);
        }
    }

    @Test
    void noFetchBeforeBarrierReleases() throws Exception {
        createCache();
        CyclicBarrier barrier = new CyclicBarrier(2);
        Worker worker = new Worker("rxcui_worker_1", segment(ACETAMINOPHEN, ASPIRIN), context(), barrier);
        Future<WorkerReport> future = executor.submit(worker);

        awaitWaiting(barrier, 1);
        assertEquals(WorkerState.AWAIT_BARRIER, worker.state());
        assertEquals(0, service.totalCalls());

        barrier.await(5, TimeUnit.SECONDS);
        WorkerReport report = future.get(5, TimeUnit.SECONDS);

        assertEquals(WorkerState.DONE, worker.state());
        assertEquals(2, report.items());
        assertEquals(4, report.stats().remoteCalls());
        assertEquals(4, channel.sentCount());
        assertEquals(List.of(keys.historicalConcept(ACETAMINOPHEN), keys.allRelated(ACETAMINOPHEN),
                keys.historicalConcept(ASPIRIN), keys.allRelated(ASPIRIN)), service.calls());
    }

    @Test
    void cachedResultsAreNotFetchedAgain() throws Exception {
        try (CacheStore w = CacheStore.open(cache, AccessMode.APPEND)) {
            w.loadIndex();
            w.append(keys.historicalConcept(ASPIRIN), "{}");
            w.append(keys.allRelated(ASPIRIN), "{}");
        }
        CyclicBarrier barrier = new CyclicBarrier(1);
        WorkerReport report = new Worker("rxcui_worker_1", segment(ASPIRIN), context(), barrier).call();

        assertEquals(0, service.totalCalls());
        assertEquals(2, report.stats().cacheHits());
        assertEquals(0, channel.sentCount());
    }

    @Test
    void emptySegmentStillPassesBarrier() throws Exception {
        createCache();
        CyclicBarrier barrier = new CyclicBarrier(1);
        Worker worker = new Worker("ndc_worker_4", new Segment(4, List.of()), context(), barrier);

        assertEquals(0, worker.call().items());
        assertEquals(WorkerState.DONE, worker.state());
    }

    @Test
    void failedSnapshotLoadStillArrivesAtBarrier() throws Exception {
        // no cache file: read-only open fails
        CyclicBarrier barrier = new CyclicBarrier(2);
        Worker worker = new Worker("rxcui_worker_1", segment(ACETAMINOPHEN), context(), barrier);
        Future<WorkerReport> future = executor.submit(worker);

        barrier.await(5, TimeUnit.SECONDS);

        ExecutionException ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(StoreUnavailableException.class, ex.getCause());
        assertEquals(WorkerState.FAILED, worker.state());
    }

    @Test
    void remoteFailureIsFatalToWorker() throws Exception {
        createCache();
        service.failTimes(keys.allRelated(ASPIRIN), 100);
        Worker worker = new Worker("rxcui_worker_1", segment(ACETAMINOPHEN, ASPIRIN, APAP_TABLET), context(),
                new CyclicBarrier(1));

        assertThrows(RemoteUnavailableException.class, worker::call);
        assertEquals(WorkerState.FAILED, worker.state());
        assertEquals(3, channel.sentCount()); // everything before the failing fetch was forwarded
        assertEquals(0, service.callsFor(keys.historicalConcept(APAP_TABLET)));
    }
}
