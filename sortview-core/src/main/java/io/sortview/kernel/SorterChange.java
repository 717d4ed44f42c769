package io.sortview.kernel;

/**
 * Hint describing how much reordering a sorter change may cause.
 */
public enum SorterChange {
    DIFFERENT,
    INVERTED,
    LESS_STRICT,
    MORE_STRICT
}
