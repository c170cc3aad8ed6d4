package dev.rxcache.pipeline;

import java.util.List;
import java.util.Objects;

/**
 * Contiguous slice of a phase's sorted work items, owned by exactly one worker.
 *
 * @param number 1-based worker number
 * @param items  the slice; may be empty when there are more workers than items
 */
public record Segment(int number, List<WorkItem> items) {
    public Segment {
        Objects.requireNonNull(items, "items cannot be null");
        items = List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public String describe() {
        if (items.isEmpty()) {
            return "no codes";
        }
        return items.size() + " codes from [" + items.get(0).code() + "] to [" + items.get(items.size() - 1).code() + "]";
    }
}
