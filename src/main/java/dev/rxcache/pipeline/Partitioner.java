package dev.rxcache.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits a sorted list into one contiguous slice per worker.
 *
 * <p>Every slice holds {@code ceil(n / workerCount)} elements except where the list runs
 * out: trailing slices may be shorter or empty. Slices are pairwise disjoint, keep the
 * input order, and together cover the whole list. Exactly {@code workerCount} slices are
 * returned.
 */
public final class Partitioner {

    private Partitioner() {
    }

    public static <T> List<List<T>> partition(List<T> sorted, int workerCount) {
        Objects.requireNonNull(sorted, "sorted cannot be null");
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be at least 1, got " + workerCount);
        }
        int n = sorted.size();
        int segmentSize = segmentSize(n, workerCount);
        List<List<T>> slices = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            int from = Math.min(n, i * segmentSize);
            int to = Math.min(n, from + segmentSize);
            slices.add(new ArrayList<>(sorted.subList(from, to)));
        }
        return slices;
    }

    public static List<Segment> segments(List<WorkItem> sortedItems, int workerCount) {
        List<List<WorkItem>> slices = partition(sortedItems, workerCount);
        List<Segment> segments = new ArrayList<>(slices.size());
        for (int i = 0; i < slices.size(); i++) {
            segments.add(new Segment(i + 1, slices.get(i)));
        }
        return segments;
    }

    static int segmentSize(int n, int workerCount) {
        return (n + workerCount - 1) / workerCount;
    }
}
