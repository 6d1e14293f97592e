package com.record.dedup.api;

import com.record.dedup.cache.CacheConfig;
import com.record.dedup.cache.CachingSimilarityAlgorithm;
import com.record.dedup.cluster.ClusterBuilder;
import com.record.dedup.core.CancellationToken;
import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.exception.DeduplicationCancelledException;
import com.record.dedup.core.exception.InvalidParameterException;
import com.record.dedup.core.model.DedupResult;
import com.record.dedup.core.model.DuplicateAssignment;
import com.record.dedup.core.model.Record;
import com.record.dedup.logging.LogContext;
import com.record.dedup.metrics.MetricsService;
import com.record.dedup.metrics.NoOpMetricsService;
import com.record.dedup.normalize.RecordNormalizer;
import com.record.dedup.similarity.BlockingIndex;
import com.record.dedup.similarity.JaroWinklerSimilarity;
import com.record.dedup.similarity.PrefixBlockingKeyStrategy;
import com.record.dedup.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Main entry point for grouping near-duplicate records.
 *
 * <p>A run normalizes records into text, buckets them by leading characters, scores
 * every pair inside a bucket and merges matching pairs into duplicate groups.</p>
 *
 * <p>Blocking trades recall for speed: two records are only ever compared when their
 * first {@code prefixLength} characters agree (ignoring case). Near-duplicates that
 * differ early, such as a typo in the first character or leading whitespace, are not
 * grouped. Use {@link #estimateComparisons} to see what a prefix length costs.</p>
 *
 * <p>The engine holds no per-run state; concurrent runs on one instance are safe.</p>
 */
public class DeduplicationEngine {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationEngine.class);

    private final RecordNormalizer normalizer;
    private final MetricsService metricsService;
    private final SimilarityAlgorithm defaultScorer;

    public DeduplicationEngine() {
        this(new RecordNormalizer(), new NoOpMetricsService());
    }

    public DeduplicationEngine(MetricsService metricsService) {
        this(new RecordNormalizer(), metricsService);
    }

    public DeduplicationEngine(RecordNormalizer normalizer, MetricsService metricsService) {
        this.normalizer = normalizer != null ? normalizer : new RecordNormalizer();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.defaultScorer = new JaroWinklerSimilarity();
    }

    /**
     * Groups record indices by the lowercased first {@code prefixLength} characters of their text.
     *
     * @throws InvalidParameterException if {@code prefixLength} is outside [1, 10]
     */
    public Map<String, List<Integer>> buildBuckets(List<String> texts, int prefixLength) {
        return BlockingIndex.build(sanitize(texts), new PrefixBlockingKeyStrategy(prefixLength)).buckets();
    }

    /**
     * Jaro-Winkler similarity of two strings, in [0, 1].
     */
    public double similarity(String a, String b) {
        return defaultScorer.compute(a, b);
    }

    /**
     * Groups near-duplicate texts.
     *
     * @param texts        normalized record texts, in original row order
     * @param threshold    minimum score for a pair to match, in [0.5, 1.0]
     * @param prefixLength blocking prefix length, in [1, 10]
     * @param callback     optional progress callback, receives (comparisons done, total)
     * @return one assignment per input text, index-aligned
     * @throws InvalidParameterException if a parameter is out of range
     */
    public List<DuplicateAssignment> clusterDuplicates(List<String> texts, double threshold, int prefixLength,
                                                       ProgressCallback callback) {
        return deduplicate(texts, DedupOptions.of(threshold, prefixLength), callback, CancellationToken.none())
                .assignments();
    }

    /**
     * Reports how many comparisons a run with {@code prefixLength} would perform.
     */
    public ComparisonEstimate estimateComparisons(List<String> texts, int prefixLength) {
        BlockingIndex index = BlockingIndex.build(sanitize(texts), new PrefixBlockingKeyStrategy(prefixLength));
        return new ComparisonEstimate(index.recordCount(), index.bucketCount(),
                index.comparisonCount(), BlockingIndex.pairCount(index.recordCount()));
    }

    /**
     * Groups near-duplicate records. Record {@code i} of the list must have index {@code i}.
     */
    public DedupResult deduplicateRecords(List<Record> records, DedupOptions options,
                                          ProgressCallback callback, CancellationToken token) {
        if (records == null) {
            throw new IllegalArgumentException("records must not be null");
        }
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i).index() != i) {
                throw new IllegalArgumentException("Record at position " + i
                        + " has index " + records.get(i).index());
            }
        }
        return deduplicate(normalizer.normalizeAll(records), options, callback, token);
    }

    /**
     * Groups near-duplicate texts.
     *
     * @param texts    normalized record texts, in original row order; {@code null} entries count as empty
     * @param options  run options
     * @param callback optional progress callback
     * @param token    optional stop flag, polled between buckets
     * @return the complete result
     * @throws DeduplicationCancelledException if {@code token} is cancelled before the run completes
     */
    public DedupResult deduplicate(List<String> texts, DedupOptions options,
                                   ProgressCallback callback, CancellationToken token) {
        DedupOptions opts = options != null ? options : DedupOptions.defaults();
        List<String> input = sanitize(texts);

        if (input.isEmpty()) {
            log.info("dedup.skipped reason=empty-input");
            return DedupResult.empty();
        }

        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forDeduplication(runId, input.size())) {
            long started = System.nanoTime();
            log.info("dedup.started options={}", opts);

            BlockingIndex index = BlockingIndex.build(input, new PrefixBlockingKeyStrategy(opts.getPrefixLength()));
            log.info("dedup.blocked buckets={} comparisons={} possible={}",
                    index.bucketCount(), index.comparisonCount(), BlockingIndex.pairCount(input.size()));

            SimilarityAlgorithm scorer = createScorer(opts);
            ClusterBuilder builder = new ClusterBuilder(scorer, opts.getThreshold(), metricsService,
                    opts.getParallelism(), opts.getProgressInterval());

            DedupResult result;
            try {
                result = builder.cluster(input, index, callback, token);
            } catch (DeduplicationCancelledException e) {
                log.warn("dedup.cancelled comparisons={}", e.getComparisonsPerformed());
                throw e;
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            metricsService.recordRunDuration(elapsed, opts.getParallelism() > 1);
            if (scorer instanceof CachingSimilarityAlgorithm cached) {
                log.debug("dedup.cache stats={}", cached.getStats());
            }
            log.info("dedup.completed result={} durationMs={}", result, elapsed.toMillis());
            return result;
        }
    }

    private SimilarityAlgorithm createScorer(DedupOptions options) {
        SimilarityAlgorithm scorer = options.getScorerType().create();
        CacheConfig cacheConfig = options.getScoreCache();
        if (cacheConfig.enabled()) {
            return new CachingSimilarityAlgorithm(scorer, cacheConfig);
        }
        return scorer;
    }

    private static List<String> sanitize(List<String> texts) {
        if (texts == null) {
            throw new IllegalArgumentException("texts must not be null");
        }
        List<String> copy = new ArrayList<>(texts.size());
        for (String text : texts) {
            copy.add(text != null ? text : "");
        }
        return copy;
    }
}
