package io.sortview.sort;

/**
 * Outcome of one time-bounded {@link SortSession#step} call.
 *
 * @param moreWork whether the session still has unsorted work left
 * @param touched  widest range moved during the call
 */
public record StepResult(boolean moreWork, TouchedRange touched) {
}
