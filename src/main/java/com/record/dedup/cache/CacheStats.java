package com.record.dedup.cache;

/**
 * Snapshot of pair-score memo usage for one run.
 *
 * @param hits      lookups answered from the memo
 * @param misses    lookups that ran the underlying scorer
 * @param evictions pairs dropped because the memo was full
 * @param entries   pairs currently memoized
 */
public record CacheStats(long hits, long misses, long evictions, long entries) {

    /**
     * Share of lookups answered from the memo, 0 when nothing was looked up.
     */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
