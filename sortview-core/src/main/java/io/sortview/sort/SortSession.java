package io.sortview.sort;

import java.time.Duration;

/**
 * One in-progress sort over a mutable array, advanced in explicit installments.
 * <p>
 * Between calls the array is always a permutation of its original contents: a session
 * only yields between whole run or merge operations.
 */
public interface SortSession {

    /**
     * Sort until the budget expires or no work is left. At least one unit of work is
     * performed if any is pending.
     *
     * @param budget wall-clock budget
     * @return whether work remains and the range moved by this call
     */
    StepResult step(Duration budget);

    /**
     * Sort to completion regardless of elapsed time.
     *
     * @return the range moved by this call
     */
    TouchedRange finish();

    boolean hasMoreWork();

    /**
     * Capture the pending runs so that an equivalent session can later be resumed with
     * {@link AdaptiveSorter#resume}.
     */
    RunState saveRuns();

    /**
     * Cap the number of entries a single merge may move before yielding.
     *
     * @param maxMergeSize entries per merge, 0 for unbounded
     */
    void setMaxMergeSize(int maxMergeSize);
}
