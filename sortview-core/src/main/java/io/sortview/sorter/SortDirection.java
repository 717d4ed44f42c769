package io.sortview.sorter;

public enum SortDirection {
    ASCENDING,
    DESCENDING;

    public SortDirection flip() {
        return this == ASCENDING ? DESCENDING : ASCENDING;
    }
}
