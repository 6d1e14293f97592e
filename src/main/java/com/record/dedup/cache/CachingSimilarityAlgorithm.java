package com.record.dedup.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.record.dedup.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed memo in front of another {@link SimilarityAlgorithm}.
 * Pays off on datasets with many repeated rows, where the same text pair is
 * scored again and again. Keys are unordered, so {@code (a, b)} and {@code (b, a)}
 * share one entry.
 */
public class CachingSimilarityAlgorithm implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CachingSimilarityAlgorithm.class);

    private final SimilarityAlgorithm delegate;
    private final Cache<PairKey, Double> cache;

    public CachingSimilarityAlgorithm(SimilarityAlgorithm delegate, CacheConfig config) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats()
                .build();
        log.debug("score.cache.created delegate={} maxSize={}", delegate.getName(), config.maxSize());
    }

    @Override
    public double compute(String s1, String s2) {
        PairKey key = PairKey.of(s1 != null ? s1 : "", s2 != null ? s2 : "");
        return cache.get(key, k -> delegate.compute(k.first(), k.second()));
    }

    @Override
    public String getName() {
        return delegate.getName() + " (cached)";
    }

    public SimilarityAlgorithm getDelegate() {
        return delegate;
    }

    public CacheStats getStats() {
        cache.cleanUp();
        com.github.benmanes.caffeine.cache.stats.CacheStats usage = cache.stats();
        return new CacheStats(usage.hitCount(), usage.missCount(), usage.evictionCount(), cache.estimatedSize());
    }

    /**
     * Unordered text pair, stored with the smaller string first.
     */
    record PairKey(String first, String second) {
        static PairKey of(String a, String b) {
            return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
        }
    }
}
