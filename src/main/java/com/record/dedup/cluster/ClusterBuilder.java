package com.record.dedup.cluster;

import com.record.dedup.core.CancellationToken;
import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.exception.DeduplicationCancelledException;
import com.record.dedup.core.exception.DeduplicationException;
import com.record.dedup.core.exception.InvalidParameterException;
import com.record.dedup.core.model.DedupResult;
import com.record.dedup.core.model.DuplicateAssignment;
import com.record.dedup.core.model.DuplicateGroup;
import com.record.dedup.metrics.MetricsService;
import com.record.dedup.metrics.NoOpMetricsService;
import com.record.dedup.similarity.BlockingIndex;
import com.record.dedup.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores every within-bucket pair and merges above-threshold pairs into duplicate groups.
 *
 * <p>Buckets are processed in index order and every unordered pair inside a bucket is
 * compared once. Pairs scoring at or above the threshold are merged through a
 * {@link UnionFind}, so membership is transitive: two records end up in the same group
 * whenever a chain of matching pairs connects them, even if their own score is below
 * the threshold.</p>
 *
 * <p>With {@code parallelism > 1} buckets are scored concurrently into per-bucket edge
 * lists, which are then merged on the calling thread in bucket order. The result is
 * identical to a sequential run.</p>
 *
 * <p>Instances hold no per-run state and may be reused.</p>
 */
public class ClusterBuilder {
    private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

    public static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private final SimilarityAlgorithm scorer;
    private final double threshold;
    private final MetricsService metricsService;
    private final int parallelism;
    private final int progressInterval;

    public ClusterBuilder(SimilarityAlgorithm scorer, double threshold) {
        this(scorer, threshold, new NoOpMetricsService(), 1, DEFAULT_PROGRESS_INTERVAL);
    }

    public ClusterBuilder(SimilarityAlgorithm scorer, double threshold, MetricsService metricsService,
                          int parallelism, int progressInterval) {
        if (scorer == null) {
            throw new IllegalArgumentException("scorer must not be null");
        }
        this.scorer = scorer;
        this.threshold = InvalidParameterException.requireInRange("threshold", threshold, 0.0, 1.0);
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.parallelism = InvalidParameterException.requireInRange(
                "parallelism", parallelism, 1, Integer.MAX_VALUE);
        this.progressInterval = InvalidParameterException.requireInRange(
                "progressInterval", progressInterval, 1, Integer.MAX_VALUE);
    }

    /**
     * Groups the records of {@code index}.
     *
     * @param texts    normalized texts, index-aligned with the records
     * @param index    blocking index built over {@code texts}
     * @param callback progress callback, receives (comparisons done, total comparisons)
     * @param token    stop flag polled between buckets
     * @return assignments for every record plus the duplicate groups
     * @throws DeduplicationCancelledException if {@code token} is cancelled before completion
     */
    public DedupResult cluster(List<String> texts, BlockingIndex index,
                               ProgressCallback callback, CancellationToken token) {
        if (texts.size() != index.recordCount()) {
            throw new IllegalArgumentException("Blocking index covers " + index.recordCount()
                    + " records but " + texts.size() + " texts were given");
        }
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        CancellationToken stop = token != null ? token : CancellationToken.none();

        UnionFind unionFind = new UnionFind(texts.size());
        ProgressTracker tracker = new ProgressTracker(index.comparisonCount(), cb);

        if (parallelism > 1 && index.bucketCount() > 1) {
            clusterParallel(texts, index, unionFind, tracker, stop);
        } else {
            clusterSequential(texts, index, unionFind, tracker, stop);
        }

        tracker.complete();
        metricsService.incrementComparisons(tracker.done);

        DedupResult result = buildResult(unionFind, tracker.done);
        metricsService.incrementGroupsFound(result.groupCount());
        return result;
    }

    public double getThreshold() {
        return threshold;
    }

    public SimilarityAlgorithm getScorer() {
        return scorer;
    }

    public int getParallelism() {
        return parallelism;
    }

    private void clusterSequential(List<String> texts, BlockingIndex index, UnionFind unionFind,
                                   ProgressTracker tracker, CancellationToken token) {
        for (Map.Entry<String, List<Integer>> bucket : index.buckets().entrySet()) {
            checkCancelled(token, tracker.done);
            List<Integer> members = bucket.getValue();
            metricsService.recordBucketSize(members.size());

            List<int[]> edges = scoreBucket(members, texts, tracker);
            mergeEdges(edges, unionFind);
            log.debug("bucket.scored key='{}' size={} edges={}", bucket.getKey(), members.size(), edges.size());
        }
    }

    private void clusterParallel(List<String> texts, BlockingIndex index, UnionFind unionFind,
                                 ProgressTracker tracker, CancellationToken token) {
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
        try {
            List<Map.Entry<String, List<Integer>>> buckets = new ArrayList<>(index.buckets().entrySet());
            List<Future<List<int[]>>> futures = new ArrayList<>(buckets.size());
            for (Map.Entry<String, List<Integer>> bucket : buckets) {
                List<Integer> members = bucket.getValue();
                // null marks a bucket skipped because of cancellation
                futures.add(executor.submit(() -> token.isCancelled() ? null : scoreBucket(members, texts, null)));
            }

            // Reconcile on this thread in bucket order
            for (int i = 0; i < futures.size(); i++) {
                checkCancelled(token, tracker.done);
                List<int[]> edges = await(futures.get(i));
                if (edges == null) {
                    checkCancelled(token, tracker.done);
                }
                List<Integer> members = buckets.get(i).getValue();
                metricsService.recordBucketSize(members.size());
                mergeEdges(edges, unionFind);
                tracker.advance(BlockingIndex.pairCount(members.size()));
                log.debug("bucket.scored key='{}' size={} edges={}",
                        buckets.get(i).getKey(), members.size(), edges.size());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Scores every unordered pair of the bucket and returns the pairs at or above threshold.
     * When {@code tracker} is non-null each comparison is reported to it.
     */
    private List<int[]> scoreBucket(List<Integer> members, List<String> texts, ProgressTracker tracker) {
        List<int[]> edges = new ArrayList<>();
        int size = members.size();
        for (int i = 0; i < size; i++) {
            int first = members.get(i);
            String firstText = texts.get(first);
            for (int j = i + 1; j < size; j++) {
                int second = members.get(j);
                double score = scorer.compute(firstText, texts.get(second));
                metricsService.recordSimilarityScore(score);
                if (score >= threshold) {
                    edges.add(new int[]{first, second});
                }
                if (tracker != null) {
                    tracker.advance(1);
                }
            }
        }
        return edges;
    }

    private void mergeEdges(List<int[]> edges, UnionFind unionFind) {
        for (int[] edge : edges) {
            if (unionFind.union(edge[0], edge[1])) {
                log.trace("records.merged first={} second={} group={}",
                        edge[0], edge[1], unionFind.groupOf(edge[0]));
            }
        }
    }

    private List<int[]> await(Future<List<int[]>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeduplicationException("Interrupted while waiting for bucket scoring", e);
        } catch (ExecutionException e) {
            throw new DeduplicationException("Bucket scoring failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private void checkCancelled(CancellationToken token, long comparisonsDone) {
        if (token.isCancelled()) {
            metricsService.incrementCancelled();
            throw new DeduplicationCancelledException(comparisonsDone);
        }
    }

    /**
     * Converts union-find state into dense group ids, ordered by first discovery.
     */
    private DedupResult buildResult(UnionFind unionFind, long comparisons) {
        int size = unionFind.size();
        TreeMap<Integer, List<Integer>> membersByRawId = new TreeMap<>();
        int[] rawIds = new int[size];
        for (int i = 0; i < size; i++) {
            rawIds[i] = unionFind.groupOf(i);
            if (rawIds[i] != UnionFind.NO_GROUP) {
                membersByRawId.computeIfAbsent(rawIds[i], k -> new ArrayList<>()).add(i);
            }
        }

        Map<Integer, Integer> denseIds = new TreeMap<>();
        List<DuplicateGroup> groups = new ArrayList<>(membersByRawId.size());
        for (Map.Entry<Integer, List<Integer>> entry : membersByRawId.entrySet()) {
            int id = groups.size();
            denseIds.put(entry.getKey(), id);
            groups.add(new DuplicateGroup(id, entry.getValue()));
        }

        List<DuplicateAssignment> assignments = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            if (rawIds[i] == UnionFind.NO_GROUP) {
                assignments.add(DuplicateAssignment.unique());
                continue;
            }
            DuplicateGroup group = groups.get(denseIds.get(rawIds[i]));
            List<Integer> rows = new ArrayList<>(group.size() - 1);
            for (int member : group.memberIndices()) {
                if (member != i) {
                    rows.add(member + 1);
                }
            }
            assignments.add(new DuplicateAssignment(group.id(), rows));
        }
        return new DedupResult(assignments, groups, comparisons);
    }

    /**
     * Counts comparisons and reports every {@code progressInterval} of them.
     * Only touched from the calling thread.
     */
    private final class ProgressTracker {
        private final long total;
        private final ProgressCallback callback;
        private long done;

        ProgressTracker(long total, ProgressCallback callback) {
            this.total = total;
            this.callback = callback;
        }

        void advance(long count) {
            long before = done;
            done += count;
            if (done / progressInterval > before / progressInterval) {
                callback.onProgress(done, total, "Processed " + done + " of " + total + " comparisons");
            }
        }

        void complete() {
            callback.onProgress(done, total, "Duplicate detection complete");
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "dedup-" + pool + "-worker-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
