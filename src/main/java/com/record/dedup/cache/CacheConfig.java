package com.record.dedup.cache;

/**
 * Settings for the per-run pair-score memo.
 *
 * <p>Scores are a pure function of the text pair and the memo lives only as long as
 * one run, so size is the only bound.</p>
 *
 * @param maxSize maximum number of memoized pairs
 * @param enabled whether scores are memoized at all
 */
public record CacheConfig(int maxSize, boolean enabled) {

    public static final int DEFAULT_MAX_SIZE = 100_000;

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
    }

    /**
     * Memo enabled with room for {@value #DEFAULT_MAX_SIZE} pairs.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_MAX_SIZE, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, false);
    }
}
