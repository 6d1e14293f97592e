package com.record.dedup.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.run.duration}: Timer (tag: mode)</li>
 *   <li>{@code dedup.comparisons}: Counter</li>
 *   <li>{@code dedup.bucket.size}: DistributionSummary</li>
 *   <li>{@code dedup.similarity.score}: DistributionSummary</li>
 *   <li>{@code dedup.groups}: Counter</li>
 *   <li>{@code dedup.cancelled}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter comparisonCounter;
    private final DistributionSummary bucketSizeSummary;
    private final DistributionSummary similarityScoreSummary;
    private final Counter groupCounter;
    private final Counter cancelledCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.comparisonCounter = Counter.builder("dedup.comparisons")
                .description("Number of pairwise similarity comparisons")
                .register(registry);
        this.bucketSizeSummary = DistributionSummary.builder("dedup.bucket.size")
                .description("Distribution of blocking bucket sizes")
                .register(registry);
        this.similarityScoreSummary = DistributionSummary.builder("dedup.similarity.score")
                .description("Distribution of similarity scores during matching")
                .register(registry);
        this.groupCounter = Counter.builder("dedup.groups")
                .description("Number of duplicate groups found")
                .register(registry);
        this.cancelledCounter = Counter.builder("dedup.cancelled")
                .description("Number of cancelled runs")
                .register(registry);
    }

    @Override
    public void recordRunDuration(Duration duration, boolean parallel) {
        String mode = parallel ? "parallel" : "sequential";
        Timer timer = timerCache.computeIfAbsent(mode, k ->
                Timer.builder("dedup.run.duration")
                        .description("Duration of deduplication runs")
                        .tag("mode", mode)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementComparisons(long count) {
        comparisonCounter.increment(count);
    }

    @Override
    public void recordBucketSize(int size) {
        bucketSizeSummary.record(size);
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScoreSummary.record(score);
    }

    @Override
    public void incrementGroupsFound(int count) {
        groupCounter.increment(count);
    }

    @Override
    public void incrementCancelled() {
        cancelledCounter.increment();
    }
}
