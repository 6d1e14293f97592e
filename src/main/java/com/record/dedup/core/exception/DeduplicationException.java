package com.record.dedup.core.exception;

/**
 * Runtime exception raised when a deduplication run cannot complete.
 */
public class DeduplicationException extends RuntimeException {

    public DeduplicationException(String message) {
        super(message);
    }

    public DeduplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
