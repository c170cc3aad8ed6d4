package dev.rxcache.pipeline;

import dev.rxcache.api.CacheQueries;
import dev.rxcache.api.TermTypeCategory;
import dev.rxcache.channel.CacheWriteChannel;
import dev.rxcache.channel.Message;
import dev.rxcache.config.CacheBuildConfig;
import dev.rxcache.error.RxCacheException;
import dev.rxcache.remote.ConceptStatus;
import dev.rxcache.remote.RemoteService;
import dev.rxcache.store.AccessMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds the cache in sequential phases, each fanning work out to isolated tasks whose
 * results converge on a single {@link CacheWriter}.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Start the writer; it stays up for the whole run.</li>
 *   <li>{@link Phase#STATUS_ENUMERATION}: fetch every status enumeration.</li>
 *   <li>Determine the code universe (ACTIVE, RETIRED, NEVER ACTIVE) and check it is disjoint
 *       from NON-RXNORM; an overlap is logged and subtracted, not fatal.</li>
 *   <li>{@link Phase#RELATED_AND_HISTORY}: partition the sorted universe across workers.</li>
 *   <li>Select drug codes from the now-cached history records.</li>
 *   <li>{@link Phase#NDC_CODES}: partition the sorted drug codes across workers.</li>
 *   <li>{@link Phase#VA_CLASS_TREE}: fetch the VA class tree and its leaf class members.</li>
 *   <li>Send {@link Message.Stop} and join the writer.</li>
 * </ol>
 * Between phases the orchestrator waits until the writer has appended everything sent so
 * far, so the next phase's snapshots include the previous phase's results.
 *
 * <p>A worker phase uses a barrier sized {@code workerCount + 1}: no worker starts fetching
 * until every worker has loaded its snapshot and the orchestrator has arrived. Failed
 * tasks are not restarted; after a failure the remaining phases are skipped, the writer is
 * still stopped and joined, and the report carries a non-zero exit code. Rerunning
 * against the partially built cache is safe because completed fetches become cache hits.
 */
public class CacheBuildOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(CacheBuildOrchestrator.class);

    public static final String LOG_NAME = "manager";
    private static final long DRAIN_POLL_SECONDS = 1;

    private final CacheBuildConfig config;
    private final RemoteService service;
    private final Clock clock;

    public CacheBuildOrchestrator(CacheBuildConfig config, RemoteService service) {
        this(config, service, Clock.systemDefaultZone());
    }

    public CacheBuildOrchestrator(CacheBuildConfig config, RemoteService service, Clock clock) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.service = service;
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        if (config.getWorkerCount() < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + config.getWorkerCount());
        }
    }

    public BuildReport run() {
        MDC.put("logName", LOG_NAME);
        try {
            return build();
        } finally {
            MDC.remove("logName");
        }
    }

    private BuildReport build() {
        logger.info("Starting cache build: cache={}, workers={}, cacheOnly={}",
                config.getCachePath(), config.getWorkerCount(), config.isFailIfNotCached());

        CacheWriteChannel channel = new CacheWriteChannel();
        TaskContext context = new TaskContext(config, service, channel, clock);
        try {
            context.openStore(AccessMode.APPEND).close(); // make sure the file exists before any read-only open
        } catch (RuntimeException e) {
            logger.error("Cannot open cache {} for append: {}", config.getCachePath(), e.getMessage(), e);
            return new BuildReport(List.of(TaskOutcome.failed(LOG_NAME, e)), List.of(), -1, 0, 0, Optional.empty());
        }

        ExecutorService writerExecutor = Executors.newSingleThreadExecutor(named("cache-writer"));
        ExecutorService taskExecutor = Executors.newFixedThreadPool(config.getWorkerCount(), named("cache-task"));
        Future<Long> writer = writerExecutor.submit(new CacheWriter(context));
        Run run = new Run(context, writer);
        try {
            run.execute(taskExecutor);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Cache build interrupted");
            run.outcomes.add(TaskOutcome.failed(LOG_NAME, e));
        } catch (RuntimeException e) {
            logger.error("Cache build failed: {}", e.getMessage(), e);
            run.outcomes.add(TaskOutcome.failed(LOG_NAME, e));
        } finally {
            run.recordsWritten = stopWriter(channel, writer, run.outcomes);
            taskExecutor.shutdownNow();
            writerExecutor.shutdownNow();
        }

        BuildReport report = new BuildReport(run.outcomes, run.phasesRun, run.recordsWritten,
                run.universeSize, run.drugCount, Optional.ofNullable(run.mismatch));
        if (report.succeeded()) {
            logger.info("Cache build complete: {} records written, {} codes, {} drug codes",
                    report.recordsWritten(), report.universeSize(), report.drugCount());
        } else {
            logger.error("Cache build finished with {} failed task(s): {}", report.failures().size(), report.failures());
        }
        return report;
    }

    private long stopWriter(CacheWriteChannel channel, Future<Long> writer, List<TaskOutcome> outcomes) {
        logger.info("Stopping Cache Writer");
        channel.send(Message.stop());
        try {
            long written = writer.get();
            outcomes.add(TaskOutcome.succeeded(CacheWriter.LOG_NAME, written + " records appended"));
            return written;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcomes.add(TaskOutcome.failed(CacheWriter.LOG_NAME, e));
        } catch (ExecutionException e) {
            logger.error("Cache Writer terminated abnormally: {}", e.getCause().getMessage());
            outcomes.add(TaskOutcome.failed(CacheWriter.LOG_NAME, e.getCause()));
        }
        return -1;
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Mutable state of one build.
     */
    private final class Run {
        final TaskContext context;
        final List<TaskOutcome> outcomes = new ArrayList<>();
        final List<Phase> phasesRun = new ArrayList<>();
        final Future<Long> writer;
        long recordsWritten = -1;
        int universeSize;
        int drugCount;
        PartitionMismatch mismatch;

        Run(TaskContext context, Future<Long> writer) {
            this.context = context;
            this.writer = writer;
        }

        void execute(ExecutorService executor) throws InterruptedException {
            if (!runSingleTask(executor, Phase.STATUS_ENUMERATION, this::enumerateStatuses)) {
                return;
            }
            awaitWriterCaughtUp();

            List<Integer> universe = determineUniverse();
            universeSize = universe.size();
            if (!runWorkerPhase(executor, Phase.RELATED_AND_HISTORY, universe,
                    EnumSet.of(Operation.ALL_RELATED, Operation.HISTORICAL_STATUS))) {
                return;
            }
            awaitWriterCaughtUp();

            List<Integer> drugs = determineDrugCodes(universe);
            drugCount = drugs.size();
            if (!runWorkerPhase(executor, Phase.NDC_CODES, drugs, EnumSet.of(Operation.NDC_CODES))) {
                return;
            }
            awaitWriterCaughtUp();

            runSingleTask(executor, Phase.VA_CLASS_TREE, this::cacheVaClasses);
        }

        private String enumerateStatuses(CacheQueries queries) {
            int codes = queries.codesByStatus(EnumSet.allOf(ConceptStatus.class)).size();
            return codes + " codes enumerated";
        }

        private String cacheVaClasses(CacheQueries queries) {
            String root = config.getVaRootClassId();
            logger.info("Determine VA drug class hierarchy from [{}]", root);
            List<String> leaves = CacheQueries.leafClassIds(queries.classTree(root));
            logger.info("Obtaining generic drugs for {} leaf VA classes", leaves.size());
            for (String classId : leaves) {
                queries.genericDrugsForVaClass(classId);
            }
            return leaves.size() + " leaf classes";
        }

        /**
         * Status enumerations come from the cache (phase 0 just fetched them); the RxNorm
         * categories must not overlap NON-RXNORM.
         */
        private List<Integer> determineUniverse() {
            try (Snapshot snapshot = context.openSnapshot()) {
                CacheQueries queries = snapshot.queries();
                Set<Integer> rxnorm = new TreeSet<>(queries.codesByStatus(ConceptStatus.RXNORM).keySet());
                Set<Integer> nonRxnorm = queries.statusEnumeration(ConceptStatus.NON_RXNORM);
                logger.info("Status enumeration: {} RxNorm codes, {} NON-RXNORM codes", rxnorm.size(), nonRxnorm.size());

                Set<Integer> overlap = new TreeSet<>(rxnorm);
                overlap.retainAll(nonRxnorm);
                if (!overlap.isEmpty()) {
                    Set<Integer> corrected = new TreeSet<>(nonRxnorm);
                    corrected.removeAll(rxnorm);
                    mismatch = new PartitionMismatch(overlap, corrected);
                    logger.warn("*** [Sanity checking] failure: found {} NON-RXNORM codes which overlapped with RxNorm codes",
                            overlap.size());
                    logger.warn("{}", overlap);
                    logger.warn("Size of non-overlapping set of NON-RXNORM codes is {}", corrected.size());
                } else {
                    logger.info("[Sanity checking] Passed: no overlap of RxNorm and NON-RXNORM codes, as expected.");
                }
                return new ArrayList<>(rxnorm);
            }
        }

        private List<Integer> determineDrugCodes(List<Integer> universe) {
            logger.info("Creating new snapshot to read the updated cache file");
            try (Snapshot snapshot = context.openSnapshot()) {
                CacheQueries queries = snapshot.queries();
                List<Integer> drugs = new ArrayList<>();
                for (Integer code : universe) {
                    Optional<String> tty = queries.termType(code);
                    if (tty.isPresent() && TermTypeCategory.of(tty.get()) == TermTypeCategory.DRUG) {
                        drugs.add(code);
                    }
                }
                logger.info("Selected {} drug codes out of {} ({})", drugs.size(), universe.size(), snapshot.client().stats());
                return drugs; // universe is sorted, so drugs are too
            }
        }

        private boolean runWorkerPhase(ExecutorService executor, Phase phase, List<Integer> sortedCodes,
                                       Set<Operation> operations) throws InterruptedException {
            phasesRun.add(phase);
            int workerCount = config.getWorkerCount();
            List<Segment> segments = Partitioner.segments(WorkItem.of(sortedCodes, operations), workerCount);
            logger.info("[{}] Creating {} worker tasks for {} codes", phase, workerCount, sortedCodes.size());

            CyclicBarrier barrier = new CyclicBarrier(workerCount + 1);
            List<Worker> workers = new ArrayList<>(workerCount);
            List<Future<WorkerReport>> futures = new ArrayList<>(workerCount);
            for (Segment segment : segments) {
                Worker worker = new Worker(phase.workerName(segment.number()), segment, context, barrier);
                workers.add(worker);
                futures.add(executor.submit(worker));
            }

            logger.info("[{}] Waiting at the barrier", phase);
            try {
                barrier.await();
                logger.info("[{}] Passing the barrier", phase);
            } catch (BrokenBarrierException e) {
                logger.error("[{}] Barrier broken; joining workers to collect failures", phase);
            }

            boolean allSucceeded = true;
            for (int i = 0; i < futures.size(); i++) {
                if (!join(workers.get(i).name(), futures.get(i))) {
                    allSucceeded = false;
                }
            }
            logger.info("[{}] Done with phase{}", phase, allSucceeded ? "" : " (with failures)");
            return allSucceeded;
        }

        private boolean runSingleTask(ExecutorService executor, Phase phase, TaskBody body) throws InterruptedException {
            phasesRun.add(phase);
            String name = phase.logName();
            Callable<WorkerReport> task = () -> {
                MDC.put("logName", name);
                logger.info("Starting {}", name);
                try (Snapshot snapshot = context.openSnapshot()) {
                    String detail = body.run(snapshot.queries());
                    logger.info("Finished {}: {} ({})", name, detail, snapshot.client().stats());
                    return new WorkerReport(name, 1, snapshot.client().stats());
                } catch (RuntimeException e) {
                    logger.error("{} failed: {}", name, e.getMessage(), e);
                    throw e;
                } finally {
                    MDC.remove("logName");
                }
            };
            return join(name, executor.submit(task));
        }

        private boolean join(String name, Future<WorkerReport> future) throws InterruptedException {
            try {
                WorkerReport report = future.get();
                outcomes.add(TaskOutcome.succeeded(name, report.items() + " items, " + report.stats()));
                return true;
            } catch (ExecutionException e) {
                logger.error("Task {} terminated abnormally: {}", name, e.getCause().toString());
                outcomes.add(TaskOutcome.failed(name, e.getCause()));
                return false;
            }
        }

        private void awaitWriterCaughtUp() throws InterruptedException {
            CacheWriteChannel channel = context.channel();
            while (!channel.awaitDrained(DRAIN_POLL_SECONDS, TimeUnit.SECONDS)) {
                if (writer.isDone()) {
                    throw new RxCacheException("Cache Writer terminated with "
                            + (channel.sentCount() - channel.acknowledgedCount()) + " write(s) pending");
                }
            }
        }
    }

    @FunctionalInterface
    private interface TaskBody {
        String run(CacheQueries queries);
    }
}
