package io.sortview.kernel;

/**
 * Ordering function that may change over time.
 * <p>
 * {@link #compare(Object, Object)} follows the {@link java.util.Comparator} sign convention.
 * Implementations notify their listeners whenever the result of {@code compare} or
 * {@link #order()} may have changed.
 *
 * @param <T> item type
 */
public interface Sorter<T> {

    int compare(T left, T right);

    SorterOrder order();

    void addListener(SorterListener listener);

    void removeListener(SorterListener listener);
}
