package com.record.dedup.metrics;

import java.time.Duration;

/**
 * Interface for recording deduplication metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    void recordRunDuration(Duration duration, boolean parallel);

    void incrementComparisons(long count);

    void recordBucketSize(int size);

    void recordSimilarityScore(double score);

    void incrementGroupsFound(int count);

    void incrementCancelled();
}
