package io.sortview.runtime;

/**
 * Tracking entry pairing an item with its index in the source as of the last
 * reconciliation.
 */
final class TrackedItem<T> {
    private T item;
    private int sourcePosition;

    TrackedItem(T item, int sourcePosition) {
        this.item = item;
        this.sourcePosition = sourcePosition;
    }

    T item() {
        return item;
    }

    int sourcePosition() {
        return sourcePosition;
    }

    void shift(int delta) {
        sourcePosition += delta;
    }

    boolean isReleased() {
        return item == null;
    }

    /**
     * Drop the engine's reference to the item.
     *
     * @throws IllegalStateException if the entry was already released
     */
    void release() {
        if (item == null) {
            throw new IllegalStateException("Tracking entry for source position " + sourcePosition + " released twice");
        }
        item = null;
    }
}
