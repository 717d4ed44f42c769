package io.sortview.runtime;

import io.sortview.core.SortViewException;
import io.sortview.sort.TouchedRange;

import java.util.Arrays;
import java.util.BitSet;

/**
 * Ordered array of tracking entries, one per live source item, sorted in place by the
 * projection's sort sessions. Slots past {@link #size()} are always null.
 */
final class TrackingArray<T> {
    private static final int DEFAULT_CAPACITY = 16;

    private TrackedItem<T>[] entries;
    private int size;

    TrackingArray() {
        this.entries = newArray(DEFAULT_CAPACITY);
    }

    @SuppressWarnings("unchecked")
    private static <T> TrackedItem<T>[] newArray(int capacity) {
        return (TrackedItem<T>[]) new TrackedItem<?>[capacity];
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    TrackedItem<T> entry(int index) {
        return entries[index];
    }

    T item(int index) {
        return entries[index].item();
    }

    /**
     * Backing array handed to sort sessions. Only {@code [0, size())} is meaningful, and
     * the reference is invalidated by {@link #append}.
     */
    TrackedItem<T>[] array() {
        return entries;
    }

    void reserve(int capacity) {
        if (capacity > entries.length) {
            entries = Arrays.copyOf(entries, Math.max(capacity, entries.length + (entries.length >> 1)));
        }
    }

    void append(T item, int sourcePosition) {
        reserve(size + 1);
        entries[size++] = new TrackedItem<>(item, sourcePosition);
    }

    /**
     * Apply a source splice to the tracked positions, dropping the entries of removed
     * items and compacting the survivors in order.
     *
     * @return where the dropped entries were
     * @throws SortViewException if the number of tracked entries inside the removed range
     *                           differs from {@code removed}
     */
    Reconciliation reconcile(int position, int removed, int added) {
        int n = size;
        int unchangedHead = n;
        int unchangedTail = n;
        BitSet removedIndices = new BitSet();

        int valid = 0;
        for (int i = 0; i < n; i++) {
            TrackedItem<T> entry = entries[i];
            int sourcePosition = entry.sourcePosition();
            if (sourcePosition >= position + removed) {
                entry.shift(added - removed);
            } else if (sourcePosition >= position) {
                unchangedHead = Math.min(unchangedHead, valid);
                unchangedTail = n - i - 1;
                removedIndices.set(i);
                entry.release();
                continue;
            }
            entries[valid++] = entry;
        }
        if (valid != n - removed) {
            throw new SortViewException("Source reported " + removed + " removed items at position " + position
                    + " but " + (n - valid) + " tracked entries fell into the removed range");
        }
        Arrays.fill(entries, valid, n, null);
        size = valid;
        return new Reconciliation(unchangedHead, unchangedTail, removedIndices);
    }

    /**
     * Smallest range outside of which every entry sits at its own source position.
     */
    TouchedRange displacedRange() {
        int start = 0;
        while (start < size && entries[start].sourcePosition() == start) {
            start++;
        }
        int end = size;
        while (end > start && entries[end - 1].sourcePosition() == end - 1) {
            end--;
        }
        return TouchedRange.between(start, end);
    }

    void clear() {
        for (int i = 0; i < size; i++) {
            entries[i].release();
            entries[i] = null;
        }
        size = 0;
    }

    /**
     * Result of {@link #reconcile}.
     *
     * @param unchangedHead  number of leading entries left in place, {@code size} before the
     *                       splice if nothing was dropped
     * @param unchangedTail  number of trailing entries after the last dropped one
     * @param removedIndices indices of dropped entries before compaction
     */
    record Reconciliation(int unchangedHead, int unchangedTail, BitSet removedIndices) {
    }
}
