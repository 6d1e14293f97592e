package com.record.dedup.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Buckets of record indices sharing a blocking key.
 *
 * <p>Buckets iterate in order of first appearance of their key and list their
 * indices ascending. Every input index appears in exactly one bucket.</p>
 */
public final class BlockingIndex {
    private static final Logger log = LoggerFactory.getLogger(BlockingIndex.class);

    private final Map<String, List<Integer>> buckets;
    private final int recordCount;

    private BlockingIndex(Map<String, List<Integer>> buckets, int recordCount) {
        this.buckets = buckets;
        this.recordCount = recordCount;
    }

    /**
     * Builds the index for the given texts.
     */
    public static BlockingIndex build(List<String> texts, BlockingKeyStrategy strategy) {
        Map<String, List<Integer>> grouped = new LinkedHashMap<>();
        for (int i = 0; i < texts.size(); i++) {
            String key = strategy.blockingKey(texts.get(i));
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }

        Map<String, List<Integer>> frozen = new LinkedHashMap<>();
        grouped.forEach((key, indices) -> frozen.put(key, List.copyOf(indices)));

        BlockingIndex index = new BlockingIndex(Collections.unmodifiableMap(frozen), texts.size());
        log.debug("Built blocking index: records={}, buckets={}, comparisons={}",
                texts.size(), frozen.size(), index.comparisonCount());
        return index;
    }

    /**
     * Bucket key to ascending record indices, in first-appearance order.
     */
    public Map<String, List<Integer>> buckets() {
        return buckets;
    }

    public int bucketCount() {
        return buckets.size();
    }

    public int recordCount() {
        return recordCount;
    }

    /**
     * Number of within-bucket pairs: sum of n(n-1)/2 over all buckets.
     */
    public long comparisonCount() {
        long total = 0;
        for (List<Integer> indices : buckets.values()) {
            total += pairCount(indices.size());
        }
        return total;
    }

    /**
     * Number of unordered pairs among {@code n} items.
     */
    public static long pairCount(long n) {
        return n * (n - 1) / 2;
    }
}
