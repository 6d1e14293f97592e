package com.record.dedup.api;

import com.record.dedup.similarity.JaroWinklerSimilarity;
import com.record.dedup.similarity.SimilarityAlgorithm;
import com.record.dedup.similarity.TokenSetSimilarity;

/**
 * Similarity algorithms selectable for a run.
 */
public enum ScorerType {

    /** Character-level Jaro-Winkler with common-prefix boost. */
    JARO_WINKLER,

    /** Order-insensitive token-set ratio. */
    TOKEN_SET;

    public SimilarityAlgorithm create() {
        return switch (this) {
            case JARO_WINKLER -> new JaroWinklerSimilarity();
            case TOKEN_SET -> new TokenSetSimilarity();
        };
    }
}
