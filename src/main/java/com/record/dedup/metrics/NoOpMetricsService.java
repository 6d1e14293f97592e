package com.record.dedup.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(Duration duration, boolean parallel) {
    }

    @Override
    public void incrementComparisons(long count) {
    }

    @Override
    public void recordBucketSize(int size) {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void incrementGroupsFound(int count) {
    }

    @Override
    public void incrementCancelled() {
    }
}
