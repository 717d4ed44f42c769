package io.sortview.kernel;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Base class holding the listeners of a {@link Sorter}.
 *
 * @param <T> item type
 */
public abstract class AbstractSorter<T> implements Sorter<T> {

    private final CopyOnWriteArrayList<SorterListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void addListener(SorterListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(SorterListener listener) {
        listeners.remove(listener);
    }

    /**
     * Notify listeners that the ordering changed.
     *
     * @param change how much reordering to expect
     */
    public void changed(SorterChange change) {
        Objects.requireNonNull(change, "change");
        for (SorterListener listener : listeners) {
            listener.sorterChanged(change);
        }
    }
}
