package dev.rxcache.pipeline;

import dev.rxcache.remote.ClientStats;

/**
 * Summary returned by a task that finished normally.
 *
 * @param name  task name, also its log name
 * @param items work items processed
 * @param stats the task's client counters
 */
public record WorkerReport(String name, int items, ClientStats stats) {
}
