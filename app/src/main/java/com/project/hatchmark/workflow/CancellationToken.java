package com.project.hatchmark.workflow;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set by the caller to abandon a running workflow. Checked between steps.
 */
public final class CancellationToken {

    private static final CancellationToken NEVER = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * A fresh token the caller may cancel.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * The shared token for callers that never cancel. {@link #cancel()} on it is rejected.
     */
    public static CancellationToken never() {
        return NEVER;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The shared never-cancelled token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
