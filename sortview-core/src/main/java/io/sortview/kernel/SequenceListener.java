package io.sortview.kernel;

/**
 * Receives splice notifications from an {@link ObservableSequence}.
 * <p>
 * {@code removed} items starting at {@code position} were replaced by {@code added} items.
 * When the listener runs, the sequence already reflects the new state.
 */
@FunctionalInterface
public interface SequenceListener {
    void itemsChanged(int position, int removed, int added);
}
