package io.sortview.schedule;

import java.util.function.BooleanSupplier;

/**
 * Cooperative event loop that runs registered steps one at a time.
 * <p>
 * A step is invoked repeatedly, interleaved with other work of the loop, for as long as it
 * returns {@code true}. Steps never run concurrently with each other or with the code that
 * registered them, though an implementation may run a step before {@code schedule} returns.
 */
public interface Scheduler {

    ScheduledStep schedule(BooleanSupplier step);
}
