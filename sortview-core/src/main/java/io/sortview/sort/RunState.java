package io.sortview.sort;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Pending sorted runs of a paused sort session.
 * <p>
 * The runs are adjacent and cover the prefix {@code [0, covered())} of the sorted array, in
 * order from the bottom of the run stack to the top. Each run is sorted; runs are not yet
 * merged with each other.
 */
public final class RunState {
    private static final RunState EMPTY = new RunState(new int[0]);

    private final int[] lengths;

    private RunState(int[] lengths) {
        this.lengths = lengths;
    }

    public static RunState empty() {
        return EMPTY;
    }

    /**
     * State of an array that is already fully sorted.
     */
    public static RunState sorted(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        return size == 0 ? EMPTY : new RunState(new int[]{size});
    }

    public static RunState of(int... lengths) {
        for (int length : lengths) {
            if (length <= 0) {
                throw new IllegalArgumentException("run lengths must be positive: " + Arrays.toString(lengths));
            }
        }
        return lengths.length == 0 ? EMPTY : new RunState(lengths.clone());
    }

    public int runCount() {
        return lengths.length;
    }

    public int runLength(int index) {
        return lengths[index];
    }

    public int[] lengths() {
        return lengths.clone();
    }

    /**
     * Number of array entries covered by the runs.
     */
    public int covered() {
        int sum = 0;
        for (int length : lengths) {
            sum += length;
        }
        return sum;
    }

    public boolean isEmpty() {
        return lengths.length == 0;
    }

    /**
     * Run state after the entries at the given indices have been removed from the array and
     * the survivors compacted in order. Removing entries keeps every run sorted, so only the
     * run lengths shrink; runs that become empty disappear.
     *
     * @param removedIndices indices of removed entries, relative to the array before removal
     * @return the adjusted run state
     */
    public RunState withoutIndices(BitSet removedIndices) {
        if (removedIndices.isEmpty() || lengths.length == 0) {
            return this;
        }
        int[] adjusted = new int[lengths.length];
        int count = 0;
        int runStart = 0;
        for (int length : lengths) {
            int runEnd = runStart + length;
            int remaining = length - removedIndices.get(runStart, runEnd).cardinality();
            if (remaining > 0) {
                adjusted[count++] = remaining;
            }
            runStart = runEnd;
        }
        return count == 0 ? EMPTY : new RunState(Arrays.copyOf(adjusted, count));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RunState other && Arrays.equals(lengths, other.lengths);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(lengths);
    }

    @Override
    public String toString() {
        return "RunState" + Arrays.toString(lengths);
    }
}
