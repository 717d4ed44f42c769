package io.sortview.kernel;

@FunctionalInterface
public interface SorterListener {
    void sorterChanged(SorterChange change);
}
