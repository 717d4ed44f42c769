package io.sortview.sorter;

import io.sortview.kernel.AbstractSorter;
import io.sortview.kernel.Sorter;
import io.sortview.kernel.SorterChange;
import io.sortview.kernel.SorterListener;
import io.sortview.kernel.SorterOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combines several sorters into a prioritized key list, the way a table sorts by the
 * column header the user clicked last and breaks ties with the previously clicked ones.
 * <p>
 * Items are compared by the first key that does not report them equal. Changes of any key
 * sorter are forwarded to this sorter's listeners.
 *
 * @param <T> item type
 */
public final class MultiSorter<T> extends AbstractSorter<T> {

    private final List<Key<T>> keys = new ArrayList<>();
    private final SorterListener keyListener = this::changed;

    @Override
    public int compare(T left, T right) {
        for (Key<T> key : keys) {
            if (key.sorter().order() == SorterOrder.NONE) {
                continue;
            }
            int result = key.sorter().compare(left, right);
            if (result != 0) {
                return key.direction() == SortDirection.ASCENDING ? result : -Integer.signum(result);
            }
        }
        return 0;
    }

    @Override
    public SorterOrder order() {
        SorterOrder result = SorterOrder.NONE;
        for (Key<T> key : keys) {
            SorterOrder order = key.sorter().order();
            if (order == SorterOrder.TOTAL) {
                return SorterOrder.TOTAL;
            }
            if (order == SorterOrder.PARTIAL) {
                result = SorterOrder.PARTIAL;
            }
        }
        return result;
    }

    /**
     * Make {@code sorter} the primary key with the given direction.
     */
    public void sortBy(Sorter<? super T> sorter, SortDirection direction) {
        Objects.requireNonNull(sorter, "sorter");
        Objects.requireNonNull(direction, "direction");
        int index = indexOf(sorter);
        if (index == 0) {
            Key<T> primary = keys.get(0);
            if (primary.direction() == direction) {
                return;
            }
            keys.set(0, new Key<>(primary.sorter(), direction));
            changed(SorterChange.INVERTED);
            return;
        }
        if (index > 0) {
            keys.remove(index);
        } else {
            sorter.addListener(keyListener);
        }
        keys.add(0, new Key<>(sorter, direction));
        changed(SorterChange.DIFFERENT);
    }

    /**
     * Flip the direction of the primary key if {@code sorter} is primary, otherwise make it
     * the primary key in ascending direction.
     */
    public void toggle(Sorter<? super T> sorter) {
        Objects.requireNonNull(sorter, "sorter");
        if (indexOf(sorter) == 0) {
            sortBy(sorter, keys.get(0).direction().flip());
        } else {
            sortBy(sorter, SortDirection.ASCENDING);
        }
    }

    public void remove(Sorter<? super T> sorter) {
        int index = indexOf(sorter);
        if (index < 0) {
            return;
        }
        keys.remove(index).sorter().removeListener(keyListener);
        changed(index == 0 ? SorterChange.DIFFERENT : SorterChange.LESS_STRICT);
    }

    public void clear() {
        if (keys.isEmpty()) {
            return;
        }
        for (Key<T> key : keys) {
            key.sorter().removeListener(keyListener);
        }
        keys.clear();
        changed(SorterChange.DIFFERENT);
    }

    public Sorter<? super T> primary() {
        return keys.isEmpty() ? null : keys.get(0).sorter();
    }

    public SortDirection primaryDirection() {
        return keys.isEmpty() ? null : keys.get(0).direction();
    }

    public int keyCount() {
        return keys.size();
    }

    private int indexOf(Sorter<? super T> sorter) {
        for (int i = 0; i < keys.size(); i++) {
            if (keys.get(i).sorter() == sorter) {
                return i;
            }
        }
        return -1;
    }

    private record Key<T>(Sorter<? super T> sorter, SortDirection direction) {
    }
}
