package com.eyelevel.invoiceprocessor.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets at most one run of a task proceed at a time. A run that finds another in progress is
 * skipped, not queued.
 */
public class NonReentrantRunGuard {

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @return {@code false} if another run was in progress and {@code task} was not executed.
     */
    public boolean runExclusively(final Runnable task) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        try {
            task.run();
            return true;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
