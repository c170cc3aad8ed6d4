package dev.rxcache.pipeline;

import java.util.Set;

/**
 * Result of a failed disjointness check between status categories that should not
 * overlap. Informational: the orchestrator logs it and continues with {@code corrected}.
 *
 * @param overlap   codes reported in both categories
 * @param corrected the second category with the overlap removed
 */
public record PartitionMismatch(Set<Integer> overlap, Set<Integer> corrected) {
    public PartitionMismatch {
        overlap = Set.copyOf(overlap);
        corrected = Set.copyOf(corrected);
    }
}
