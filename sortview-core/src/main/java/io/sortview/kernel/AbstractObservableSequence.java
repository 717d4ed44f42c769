package io.sortview.kernel;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Base class holding the listeners of an {@link ObservableSequence}.
 * <p>
 * Listeners may add or remove listeners while being notified; such changes take
 * effect with the next notification.
 *
 * @param <T> item type
 */
public abstract class AbstractObservableSequence<T> implements ObservableSequence<T> {

    private final CopyOnWriteArrayList<SequenceListener> listeners = new CopyOnWriteArrayList<>();

    @Override
    public void addListener(SequenceListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(SequenceListener listener) {
        listeners.remove(listener);
    }

    protected void fireItemsChanged(int position, int removed, int added) {
        for (SequenceListener listener : listeners) {
            listener.itemsChanged(position, removed, added);
        }
    }
}
