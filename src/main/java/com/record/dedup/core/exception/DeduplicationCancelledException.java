package com.record.dedup.core.exception;

/**
 * Thrown when a run is stopped through its cancellation token.
 * No partial result is produced.
 */
public class DeduplicationCancelledException extends DeduplicationException {

    private final long comparisonsPerformed;

    public DeduplicationCancelledException(long comparisonsPerformed) {
        super("Deduplication cancelled after " + comparisonsPerformed + " comparisons");
        this.comparisonsPerformed = comparisonsPerformed;
    }

    public long getComparisonsPerformed() {
        return comparisonsPerformed;
    }
}
