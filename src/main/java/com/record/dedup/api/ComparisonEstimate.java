package com.record.dedup.api;

/**
 * Cost of a run before it starts.
 *
 * @param recordCount         number of records
 * @param bucketCount         number of blocking buckets
 * @param comparisons         within-bucket comparisons the run will perform
 * @param possibleComparisons comparisons a full pairwise scan would perform
 */
public record ComparisonEstimate(int recordCount, int bucketCount, long comparisons, long possibleComparisons) {

    /**
     * Share of the full pairwise cost that will be performed, in percent.
     * Zero when fewer than two records are present.
     */
    public double percentOfFull() {
        return possibleComparisons == 0 ? 0.0 : comparisons * 100.0 / possibleComparisons;
    }

    @Override
    public String toString() {
        return String.format("ComparisonEstimate{records=%d, buckets=%d, comparisons=%d, possible=%d, percent=%.1f}",
                recordCount, bucketCount, comparisons, possibleComparisons, percentOfFull());
    }
}
