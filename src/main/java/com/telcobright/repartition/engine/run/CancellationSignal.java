package com.telcobright.repartition.engine.run;

import com.telcobright.repartition.core.exception.StepCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for long steps. Checked at batch boundaries only;
 * a statement already sent to the database runs to completion or timeout.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Clear a previous request so a retried step can run.
     */
    public void reset() {
        cancelled.set(false);
    }

    public void throwIfCancelled(StepContext context, String step) {
        if (cancelled.get()) {
            throw new StepCancelledException("Step " + step + " cancelled by operator",
                context.getIdentity(), context.getPhase());
        }
    }
}
