package dev.rxcache.pipeline;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a cache build.
 *
 * @param outcomes       every task that ran, in completion order
 * @param phasesRun      phases that were started
 * @param recordsWritten records the writer appended, or -1 if it failed
 * @param universeSize   RxNorm codes processed in the related/history phase
 * @param drugCount      drug codes processed in the NDC phase
 * @param mismatch       status-category overlap found by the sanity check, if any
 */
public record BuildReport(List<TaskOutcome> outcomes,
                          List<Phase> phasesRun,
                          long recordsWritten,
                          int universeSize,
                          int drugCount,
                          Optional<PartitionMismatch> mismatch) {

    public BuildReport {
        outcomes = List.copyOf(outcomes);
        phasesRun = List.copyOf(phasesRun);
    }

    public boolean succeeded() {
        return outcomes.stream().noneMatch(TaskOutcome::failed);
    }

    public int exitCode() {
        return succeeded() ? 0 : 1;
    }

    public List<TaskOutcome> failures() {
        return outcomes.stream().filter(TaskOutcome::failed).toList();
    }
}
