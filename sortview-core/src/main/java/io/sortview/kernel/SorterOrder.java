package io.sortview.kernel;

public enum SorterOrder {
    /**
     * Items are left in source order.
     */
    NONE,
    /**
     * Some distinct items compare equal.
     */
    PARTIAL,
    /**
     * Only identical items compare equal.
     */
    TOTAL
}
