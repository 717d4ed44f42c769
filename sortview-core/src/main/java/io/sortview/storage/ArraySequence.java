package io.sortview.storage;

import io.sortview.kernel.AbstractObservableSequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Mutable list store that reports each mutation as one splice notification.
 * <p>
 * Items must not be null. Not thread-safe. Listeners run synchronously after the store
 * has been updated.
 *
 * @param <T> item type
 */
public final class ArraySequence<T> extends AbstractObservableSequence<T> {

    private final ArrayList<T> items;

    public ArraySequence() {
        this.items = new ArrayList<>();
    }

    public ArraySequence(Collection<? extends T> initial) {
        this.items = new ArrayList<>(initial);
    }

    @SafeVarargs
    public static <T> ArraySequence<T> of(T... items) {
        return new ArraySequence<>(Arrays.asList(items));
    }

    @Override
    public int size() {
        return items.size();
    }

    @Override
    public T get(int position) {
        if (position < 0 || position >= items.size()) {
            return null;
        }
        return items.get(position);
    }

    public void add(T item) {
        splice(items.size(), 0, List.of(item));
    }

    public void addAll(Collection<? extends T> added) {
        splice(items.size(), 0, added);
    }

    public void insert(int position, T item) {
        splice(position, 0, List.of(item));
    }

    public T set(int position, T item) {
        T previous = items.get(position);
        splice(position, 1, List.of(item));
        return previous;
    }

    public T remove(int position) {
        T removed = items.get(position);
        splice(position, 1, List.of());
        return removed;
    }

    public void clear() {
        splice(0, items.size(), List.of());
    }

    /**
     * Replace {@code removeCount} items starting at {@code position} with {@code added}.
     *
     * @throws IndexOutOfBoundsException if the removed range does not lie within the store
     */
    public void splice(int position, int removeCount, Collection<? extends T> added) {
        Objects.requireNonNull(added, "added");
        if (position < 0 || removeCount < 0 || position > items.size() - removeCount) {
            throw new IndexOutOfBoundsException(
                    "splice(" + position + ", " + removeCount + ") on sequence of size " + items.size());
        }
        for (T item : added) {
            Objects.requireNonNull(item, "sequence items must not be null");
        }
        if (removeCount == 0 && added.isEmpty()) {
            return;
        }
        items.subList(position, position + removeCount).clear();
        items.addAll(position, added);
        fireItemsChanged(position, removeCount, added.size());
    }

    public List<T> snapshot() {
        return List.copyOf(items);
    }
}
