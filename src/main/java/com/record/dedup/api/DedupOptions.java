package com.record.dedup.api;

import com.record.dedup.cache.CacheConfig;
import com.record.dedup.cluster.ClusterBuilder;
import com.record.dedup.core.exception.InvalidParameterException;
import com.record.dedup.similarity.PrefixBlockingKeyStrategy;

/**
 * Options for a deduplication run.
 * Configures the match threshold, blocking prefix, scorer and execution.
 */
public class DedupOptions {

    public static final double MIN_THRESHOLD = 0.5;
    public static final double MAX_THRESHOLD = 1.0;

    private static final double DEFAULT_THRESHOLD = 0.9;
    private static final int DEFAULT_PREFIX_LENGTH = 3;

    private final double threshold;
    private final int prefixLength;
    private final ScorerType scorerType;
    private final int parallelism;
    private final CacheConfig scoreCache;
    private final int progressInterval;

    private DedupOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.prefixLength = builder.prefixLength;
        this.scorerType = builder.scorerType;
        this.parallelism = builder.parallelism;
        this.scoreCache = builder.scoreCache;
        this.progressInterval = builder.progressInterval;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getPrefixLength() {
        return prefixLength;
    }

    public ScorerType getScorerType() {
        return scorerType;
    }

    public int getParallelism() {
        return parallelism;
    }

    public CacheConfig getScoreCache() {
        return scoreCache;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    /**
     * Creates default options.
     */
    public static DedupOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options for the given threshold and prefix length, other values default.
     */
    public static DedupOptions of(double threshold, int prefixLength) {
        return builder().threshold(threshold).prefixLength(prefixLength).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int prefixLength = DEFAULT_PREFIX_LENGTH;
        private ScorerType scorerType = ScorerType.JARO_WINKLER;
        private int parallelism = 1;
        private CacheConfig scoreCache = CacheConfig.disabled();
        private int progressInterval = ClusterBuilder.DEFAULT_PROGRESS_INTERVAL;

        public Builder threshold(double threshold) {
            this.threshold = InvalidParameterException.requireInRange(
                    "threshold", threshold, MIN_THRESHOLD, MAX_THRESHOLD);
            return this;
        }

        public Builder prefixLength(int prefixLength) {
            this.prefixLength = InvalidParameterException.requireInRange("prefixLength", prefixLength,
                    PrefixBlockingKeyStrategy.MIN_PREFIX_LENGTH, PrefixBlockingKeyStrategy.MAX_PREFIX_LENGTH);
            return this;
        }

        public Builder scorerType(ScorerType scorerType) {
            if (scorerType == null) {
                throw new InvalidParameterException("scorerType", "must not be null");
            }
            this.scorerType = scorerType;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new InvalidParameterException("parallelism", "must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder scoreCache(CacheConfig scoreCache) {
            this.scoreCache = scoreCache != null ? scoreCache : CacheConfig.disabled();
            return this;
        }

        public Builder progressInterval(int progressInterval) {
            if (progressInterval < 1) {
                throw new InvalidParameterException("progressInterval", "must be positive");
            }
            this.progressInterval = progressInterval;
            return this;
        }

        public DedupOptions build() {
            return new DedupOptions(this);
        }
    }

    @Override
    public String toString() {
        return "DedupOptions{" +
                "threshold=" + threshold +
                ", prefixLength=" + prefixLength +
                ", scorerType=" + scorerType +
                ", parallelism=" + parallelism +
                ", scoreCache=" + scoreCache.enabled() +
                ", progressInterval=" + progressInterval +
                '}';
    }
}
