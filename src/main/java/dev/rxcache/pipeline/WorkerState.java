package dev.rxcache.pipeline;

public enum WorkerState {
    /** Opening the cache read-only and loading the snapshot index. */
    INIT,
    /** Waiting for every peer and the orchestrator to finish loading. */
    AWAIT_BARRIER,
    PROCESSING,
    DONE,
    FAILED
}
