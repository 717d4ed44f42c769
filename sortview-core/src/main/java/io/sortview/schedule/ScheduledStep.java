package io.sortview.schedule;

/**
 * Handle of a step registered with a {@link Scheduler}.
 */
public interface ScheduledStep {

    /**
     * Unregister the step. Calling this more than once, or after the step finished on its
     * own, has no effect.
     */
    void cancel();

    boolean isActive();
}
