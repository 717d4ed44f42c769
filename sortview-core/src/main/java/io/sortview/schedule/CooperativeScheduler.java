package io.sortview.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Single-threaded idle queue driven explicitly by its owner.
 * <p>
 * Each call to {@link #runOnce()} invokes every step that was active when the pass began,
 * in registration order. Steps registered during a pass run in the next pass. A step that
 * throws is unregistered and the exception propagates to the caller of {@code runOnce}.
 * <p>
 * Not thread-safe: registration and passes must happen on the owning thread.
 */
public final class CooperativeScheduler implements Scheduler {

    private static final Logger log = LoggerFactory.getLogger(CooperativeScheduler.class);

    private final List<Registration> registrations = new ArrayList<>();

    @Override
    public ScheduledStep schedule(BooleanSupplier step) {
        var registration = new Registration(Objects.requireNonNull(step, "step"));
        registrations.add(registration);
        return registration;
    }

    /**
     * Run one pass over the active steps.
     *
     * @return true if steps remain registered afterwards
     */
    public boolean runOnce() {
        for (Registration registration : List.copyOf(registrations)) {
            if (!registration.active) {
                continue;
            }
            boolean again;
            try {
                again = registration.step.getAsBoolean();
            } catch (RuntimeException | Error e) {
                log.debug("Unregistering step that failed: {}", e.toString());
                registration.cancel();
                throw e;
            }
            if (!again) {
                registration.cancel();
            }
        }
        return !registrations.isEmpty();
    }

    /**
     * Run passes until no step is registered.
     *
     * @return number of passes performed
     */
    public int runUntilIdle() {
        int passes = 0;
        while (!registrations.isEmpty()) {
            runOnce();
            passes++;
        }
        return passes;
    }

    public int pendingCount() {
        return registrations.size();
    }

    private final class Registration implements ScheduledStep {
        private final BooleanSupplier step;
        private boolean active = true;

        private Registration(BooleanSupplier step) {
            this.step = step;
        }

        @Override
        public void cancel() {
            if (active) {
                active = false;
                registrations.remove(this);
            }
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
