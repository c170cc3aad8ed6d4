package dev.rxcache.pipeline;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PartitionerTest {

    private static List<Integer> range(int n) {
        return IntStream.rangeClosed(1, n).boxed().collect(Collectors.toList());
    }

    @Test
    void tenCodesOverFourWorkers() {
        List<List<Integer>> slices = Partitioner.partition(range(10), 4);
        assertEquals(List.of(List.of(1, 2, 3), List.of(4, 5, 6), List.of(7, 8, 9), List.of(10)), slices);
    }

    @Test
    void trailingSlicesMayBeEmpty() {
        List<List<Integer>> slices = Partitioner.partition(range(5), 4);
        assertEquals(List.of(2, 2, 1, 0), slices.stream().map(List::size).collect(Collectors.toList()));
    }

    @Test
    void sliceSizeIsCeilingOfShare() {
        assertEquals(3, Partitioner.segmentSize(10, 4));
        assertEquals(3, Partitioner.segmentSize(9, 3));
        assertEquals(1, Partitioner.segmentSize(1, 8));
        assertEquals(0, Partitioner.segmentSize(0, 2));
    }

    @Test
    void emptyInputGivesEmptySlices() {
        List<List<Integer>> slices = Partitioner.partition(List.of(), 3);
        assertEquals(3, slices.size());
        assertTrue(slices.stream().allMatch(List::isEmpty));
    }

    @Test
    void slicesCoverInputDisjointlyInOrder() {
        for (int n = 0; n <= 40; n++) {
            for (int w = 1; w <= 9; w++) {
                List<Integer> codes = range(n);
                List<List<Integer>> slices = Partitioner.partition(codes, w);
                assertEquals(w, slices.size());

                int ceil = Partitioner.segmentSize(n, w);
                List<Integer> joined = new ArrayList<>();
                Set<Integer> distinct = new HashSet<>();
                for (int i = 0; i < w; i++) {
                    List<Integer> slice = slices.get(i);
                    int expected = Math.max(0, Math.min(ceil, n - i * ceil));
                    assertEquals(expected, slice.size(), "slice " + i + ", n=" + n + " w=" + w);
                    joined.addAll(slice);
                    distinct.addAll(slice);
                }
                assertEquals(codes, joined, "n=" + n + " w=" + w);
                assertEquals(n, distinct.size());
            }
        }
    }

    @Test
    void segmentsAreNumberedFromOne() {
        List<Segment> segments = Partitioner.segments(
                WorkItem.of(range(7), EnumSet.of(Operation.NDC_CODES)), 3);
        assertEquals(List.of(1, 2, 3), segments.stream().map(Segment::number).collect(Collectors.toList()));
        assertEquals("3 codes from [1] to [3]", segments.get(0).describe());
        assertEquals(1, segments.get(2).size());
    }

    @Test
    void rejectsNonPositiveWorkerCount() {
        assertThrows(IllegalArgumentException.class, () -> Partitioner.partition(range(3), 0));
    }
}
