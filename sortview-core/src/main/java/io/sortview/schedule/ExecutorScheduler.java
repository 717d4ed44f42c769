package io.sortview.schedule;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Runs steps as tasks of an {@link Executor}, resubmitting a step after each invocation
 * that asks for more.
 * <p>
 * The executor must run tasks one at a time on the thread that owns the scheduled work,
 * for example a UI event thread. A direct executor such as {@code Runnable::run} is
 * allowed: the step then runs to completion inside {@link #schedule}, one invocation after
 * another without growing the stack. Cancellation is observed before each invocation.
 */
public final class ExecutorScheduler implements Scheduler {

    private final Executor executor;

    public ExecutorScheduler(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public ScheduledStep schedule(BooleanSupplier step) {
        var task = new StepTask(Objects.requireNonNull(step, "step"));
        executor.execute(task);
        return task;
    }

    private final class StepTask implements Runnable, ScheduledStep {
        private final BooleanSupplier step;
        private volatile boolean active = true;
        // set while run() is on the stack, so a direct executor loops instead of recursing
        private boolean running;
        private boolean rerun;

        private StepTask(BooleanSupplier step) {
            this.step = step;
        }

        @Override
        public void run() {
            if (running) {
                rerun = true;
                return;
            }
            running = true;
            try {
                do {
                    rerun = false;
                    if (!active) {
                        return;
                    }
                    invoke();
                } while (rerun);
            } finally {
                running = false;
            }
        }

        private void invoke() {
            boolean again;
            try {
                again = step.getAsBoolean();
            } catch (RuntimeException | Error e) {
                active = false;
                throw e;
            }
            if (again && active) {
                executor.execute(this);
            } else {
                active = false;
            }
        }

        @Override
        public void cancel() {
            active = false;
        }

        @Override
        public boolean isActive() {
            return active;
        }
    }
}
