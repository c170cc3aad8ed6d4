package dev.rxcache.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A concept code and the queries to run for it in the current phase. Operations run in
 * declaration order of {@link Operation}.
 */
public record WorkItem(int code, Set<Operation> operations) {
    public WorkItem {
        Objects.requireNonNull(operations, "operations cannot be null");
        if (operations.isEmpty()) {
            throw new IllegalArgumentException("operations cannot be empty for code " + code);
        }
        operations = Collections.unmodifiableSet(EnumSet.copyOf(operations));
    }

    public static List<WorkItem> of(List<Integer> sortedCodes, Set<Operation> operations) {
        List<WorkItem> items = new ArrayList<>(sortedCodes.size());
        for (Integer code : sortedCodes) {
            items.add(new WorkItem(code, operations));
        }
        return items;
    }
}
