package dev.rxcache.pipeline;

import dev.rxcache.remote.RemoteClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;

/**
 * Fetches every operation of every work item in one segment.
 *
 * <p>Lifecycle: {@link WorkerState#INIT} loads a private snapshot of the cache;
 * {@link WorkerState#AWAIT_BARRIER} waits until all peers (and the orchestrator) have
 * loaded theirs, so no snapshot can include results fetched during this phase;
 * {@link WorkerState#PROCESSING} runs the fetches, each one either a cache hit or a
 * remote call whose result the client forwards to the writer; {@link WorkerState#DONE}
 * releases the snapshot.
 *
 * <p>Any exception is fatal to the worker and is rethrown to whoever joins it. Siblings
 * are not cancelled.
 */
public class Worker implements Callable<WorkerReport> {
    private static final Logger logger = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final Segment segment;
    private final TaskContext context;
    private final CyclicBarrier barrier;
    private volatile WorkerState state = WorkerState.INIT;

    /**
     * @param name    task and log name, e.g. {@code rxcui_worker_2}
     * @param segment the items this worker owns
     * @param context run-wide settings and the writer channel
     * @param barrier phase barrier sized {@code workerCount + 1}
     */
    public Worker(String name, Segment segment, TaskContext context, CyclicBarrier barrier) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.segment = Objects.requireNonNull(segment, "segment cannot be null");
        this.context = Objects.requireNonNull(context, "context cannot be null");
        this.barrier = Objects.requireNonNull(barrier, "barrier cannot be null");
    }

    @Override
    public WorkerReport call() throws Exception {
        MDC.put("logName", name);
        MDC.put("worker", name);
        logger.info("Worker {} -- processing {}", name, segment.describe());
        Snapshot snapshot = null;
        try {
            try {
                snapshot = context.openSnapshot();
            } catch (RuntimeException e) {
                state = WorkerState.FAILED;
                logger.error("Worker {} failed to load the cache snapshot: {}", name, e.getMessage(), e);
                arriveAfterFailure();
                throw e;
            }

            state = WorkerState.AWAIT_BARRIER;
            logger.info("Waiting at the barrier");
            barrier.await();
            logger.info("Passing the barrier");

            state = WorkerState.PROCESSING;
            process(snapshot.client());

            state = WorkerState.DONE;
            logger.info("Finished processing {} codes ... terminating. {}", segment.size(), snapshot.client().stats());
            return new WorkerReport(name, segment.size(), snapshot.client().stats());
        } catch (Exception e) {
            if (state != WorkerState.FAILED) {
                state = WorkerState.FAILED;
                logger.error("Worker {} failed: {}", name, e.getMessage(), e);
            }
            throw e;
        } finally {
            if (snapshot != null) {
                snapshot.close();
            }
            MDC.remove("worker");
            MDC.remove("logName");
        }
    }

    private void process(RemoteClient client) {
        List<WorkItem> items = segment.items();
        int interval = Math.max(1, context.config().getWorkerProgressInterval());
        for (int idx = 0; idx < items.size(); idx++) {
            WorkItem item = items.get(idx);
            for (Operation operation : item.operations()) {
                // result goes to the writer through the client's forwarding
                client.fetch(operation.requestKey(context.keys(), item.code()));
            }
            if (idx % interval == 0) {
                logger.info("Processed {}/{} codes, last was [{}]", idx + 1, items.size(), item.code());
            }
        }
    }

    // Still counts toward the barrier, so peers and the orchestrator are not left waiting on a dead worker.
    private void arriveAfterFailure() throws InterruptedException {
        try {
            barrier.await();
        } catch (BrokenBarrierException e) {
            logger.warn("Barrier already broken while worker {} was failing", name);
        }
    }

    public WorkerState state() {
        return state;
    }

    public String name() {
        return name;
    }
}
