package io.sortview.kernel;

/**
 * Randomly indexable, ordered collection that reports every mutation as a single splice.
 *
 * @param <T> item type
 */
public interface ObservableSequence<T> {

    int size();

    /**
     * @param position index of the item
     * @return the item, or {@code null} if {@code position} is out of range
     */
    T get(int position);

    void addListener(SequenceListener listener);

    void removeListener(SequenceListener listener);
}
