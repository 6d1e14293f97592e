package com.record.dedup.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop flag shared between a caller and a running deduplication.
 * The run polls it between buckets.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
