package dev.rxcache.pipeline;

/**
 * How one task of a build ended.
 *
 * @param task   task name (its log name)
 * @param failed whether it terminated abnormally
 * @param detail report summary, or the failure message
 */
public record TaskOutcome(String task, boolean failed, String detail) {

    static TaskOutcome succeeded(String task, String detail) {
        return new TaskOutcome(task, false, detail);
    }

    static TaskOutcome failed(String task, Throwable cause) {
        return new TaskOutcome(task, true, cause.getClass().getSimpleName() + ": " + cause.getMessage());
    }
}
