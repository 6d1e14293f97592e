package com.record.dedup.similarity;

/**
 * Strategy interface for deriving the blocking key of a normalized record text.
 * Blocking keys narrow the candidate set for fuzzy matching: only records that
 * share a key are ever compared, avoiding a full O(n²) pairwise scan.
 *
 * <p>Every text must map to exactly one key so that no record is dropped.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Derives the blocking key for a normalized record text.
     *
     * @param normalizedText the normalized text, {@code null} is treated as empty
     * @return the blocking key (never null, may be empty)
     */
    String blockingKey(String normalizedText);
}
