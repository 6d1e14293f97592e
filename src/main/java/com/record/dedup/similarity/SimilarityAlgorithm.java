package com.record.dedup.similarity;

/**
 * Interface for similarity computation algorithms.
 * All implementations return a symmetric score between 0.0 (no similarity) and 1.0 (identical),
 * treat {@code null} as the empty string, and score two empty strings as 1.0.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two strings.
     *
     * @param s1 first string
     * @param s2 second string
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
