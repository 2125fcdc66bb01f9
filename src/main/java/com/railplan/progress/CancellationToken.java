package com.railplan.progress;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a caller and a long running computation. The computation checks it at
 * well defined points and stops there, leaving its inputs untouched.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel () {
        cancelled.set(true);
    }

    public boolean isCancelled () {
        return cancelled.get();
    }

    /** A token that is never cancelled. */
    public static CancellationToken none () {
        return new CancellationToken();
    }

}
