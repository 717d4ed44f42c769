package io.sortview.sorter;

import io.sortview.kernel.AbstractSorter;
import io.sortview.kernel.SorterChange;
import io.sortview.kernel.SorterOrder;

import java.util.Comparator;
import java.util.Objects;

/**
 * {@link io.sortview.kernel.Sorter} backed by a {@link Comparator} that can be replaced or
 * reversed at runtime.
 * <p>
 * Without a comparator the sorter reports {@link SorterOrder#NONE}. Call
 * {@link #changed(SorterChange)} when the comparator's results change for other reasons,
 * for example because it reads external state.
 *
 * @param <T> item type
 */
public final class ComparatorSorter<T> extends AbstractSorter<T> {

    private final SorterOrder declaredOrder;
    private Comparator<? super T> comparator;
    private boolean reversed;

    public ComparatorSorter(Comparator<? super T> comparator) {
        this(comparator, SorterOrder.PARTIAL);
    }

    /**
     * @param comparator    the comparator, or null for no order
     * @param declaredOrder order kind reported while a comparator is set
     */
    public ComparatorSorter(Comparator<? super T> comparator, SorterOrder declaredOrder) {
        Objects.requireNonNull(declaredOrder, "declaredOrder");
        if (declaredOrder == SorterOrder.NONE) {
            throw new IllegalArgumentException("declaredOrder must be PARTIAL or TOTAL");
        }
        this.comparator = comparator;
        this.declaredOrder = declaredOrder;
    }

    /**
     * Sorter for a comparator that only reports equality for identical items.
     */
    public static <T> ComparatorSorter<T> total(Comparator<? super T> comparator) {
        return new ComparatorSorter<>(Objects.requireNonNull(comparator, "comparator"), SorterOrder.TOTAL);
    }

    @Override
    public int compare(T left, T right) {
        if (comparator == null) {
            return 0;
        }
        int result = comparator.compare(left, right);
        return reversed ? -Integer.signum(result) : result;
    }

    @Override
    public SorterOrder order() {
        return comparator == null ? SorterOrder.NONE : declaredOrder;
    }

    public Comparator<? super T> comparator() {
        return comparator;
    }

    public void setComparator(Comparator<? super T> comparator) {
        if (this.comparator == comparator) {
            return;
        }
        this.comparator = comparator;
        changed(SorterChange.DIFFERENT);
    }

    public boolean isReversed() {
        return reversed;
    }

    public void setReversed(boolean reversed) {
        if (this.reversed == reversed) {
            return;
        }
        this.reversed = reversed;
        changed(SorterChange.INVERTED);
    }
}
