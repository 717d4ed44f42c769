package io.sortview.sort;

import java.util.Comparator;
import java.util.Objects;

/**
 * {@link AdaptiveSorter} backed by a stepping TimSort.
 */
public final class TimSorter implements AdaptiveSorter {

    @Override
    public <E> SortSession begin(E[] array, int size, Comparator<? super E> comparator) {
        return resume(array, size, comparator, RunState.empty());
    }

    @Override
    public <E> SortSession resume(E[] array, int size, Comparator<? super E> comparator, RunState runs) {
        Objects.requireNonNull(array, "array");
        Objects.requireNonNull(comparator, "comparator");
        Objects.requireNonNull(runs, "runs");
        if (size < 0 || size > array.length) {
            throw new IllegalArgumentException("size " + size + " out of bounds for array of length " + array.length);
        }
        if (runs.covered() > size) {
            throw new IllegalArgumentException(
                    "Run state covers " + runs.covered() + " entries but the array holds " + size);
        }
        return new TimSortSession<>(array, size, comparator, runs);
    }
}
