package com.raditha.extract.util;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal threaded through every analysis stage.
 * The caller cancels; stages poll between units of work.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * A token that is never cancelled by anyone else.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        if (this == NONE) {
            throw new IllegalStateException("The shared 'none' token cannot be cancelled");
        }
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * @throws ExtractionCancelledException if the caller has cancelled
     */
    public void throwIfCancellationRequested() {
        if (cancelled.get()) {
            throw new ExtractionCancelledException("Extraction analysis was cancelled");
        }
    }
}
