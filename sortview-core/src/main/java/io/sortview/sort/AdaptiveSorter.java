package io.sortview.sort;

import java.util.Comparator;

/**
 * Factory of stable, resumable {@link SortSession}s that sort an array prefix in place.
 */
public interface AdaptiveSorter {

    /**
     * Start sorting {@code array[0, size)} from scratch.
     */
    <E> SortSession begin(E[] array, int size, Comparator<? super E> comparator);

    /**
     * Continue a sort whose pending runs were captured with {@link SortSession#saveRuns()}.
     * The array may have changed size since, but must still hold the runs in order.
     *
     * @throws IllegalArgumentException if the runs cover more than {@code size} entries
     */
    <E> SortSession resume(E[] array, int size, Comparator<? super E> comparator, RunState runs);
}
