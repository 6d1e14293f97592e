package com.record.dedup.api;

import com.record.dedup.cache.CacheConfig;
import com.record.dedup.core.CancellationToken;
import com.record.dedup.core.ProgressCallback;
import com.record.dedup.core.exception.DeduplicationCancelledException;
import com.record.dedup.core.exception.InvalidParameterException;
import com.record.dedup.core.model.DedupResult;
import com.record.dedup.core.model.DuplicateAssignment;
import com.record.dedup.core.model.Record;
import com.record.dedup.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DeduplicationEngineTest {

    private static final List<String> PIES = List.of("apple pie", "appel pie", "banana", "applle pie");

    private DeduplicationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DeduplicationEngine();
    }

    @Nested
    @DisplayName("clusterDuplicates")
    class ClusterDuplicatesTests {

        @Test
        @DisplayName("Similar pies group together and banana stays unique")
        void groupsPies() {
            List<DuplicateAssignment> assignments = engine.clusterDuplicates(PIES, 0.85, 2, null);

            assertEquals(4, assignments.size());
            assertEquals(new DuplicateAssignment(0, List.of(2, 4)), assignments.get(0));
            assertEquals(new DuplicateAssignment(0, List.of(1, 4)), assignments.get(1));
            assertEquals(DuplicateAssignment.unique(), assignments.get(2));
            assertEquals(new DuplicateAssignment(0, List.of(1, 2)), assignments.get(3));
        }

        @Test
        @DisplayName("Threshold 1.0 merges only identical strings")
        void exactThreshold() {
            List<DuplicateAssignment> assignments = engine.clusterDuplicates(
                    List.of("apple pie", "appel pie", "apple pie"), 1.0, 2, null);

            assertEquals(new DuplicateAssignment(0, List.of(3)), assignments.get(0));
            assertFalse(assignments.get(1).isDuplicate());
            assertEquals(new DuplicateAssignment(0, List.of(1)), assignments.get(2));
        }

        @Test
        @DisplayName("Prefix longer than the texts uses the whole text as key")
        void prefixLongerThanText() {
            List<DuplicateAssignment> assignments = engine.clusterDuplicates(
                    List.of("abc", "abc", "abcd"), 0.9, 10, null);

            assertEquals(0, assignments.get(0).groupId());
            assertEquals(0, assignments.get(1).groupId());
            assertEquals(-1, assignments.get(2).groupId());
        }

        @Test
        @DisplayName("Empty input returns an empty list")
        void emptyInput() {
            assertTrue(engine.clusterDuplicates(List.of(), 0.9, 3, null).isEmpty());
        }

        @Test
        @DisplayName("Records with empty text collide and match each other")
        void emptyTextsCollide() {
            List<String> texts = Arrays.asList("", null, "something");
            List<DuplicateAssignment> assignments = engine.clusterDuplicates(texts, 0.9, 3, null);

            assertEquals(new DuplicateAssignment(0, List.of(2)), assignments.get(0));
            assertEquals(new DuplicateAssignment(0, List.of(1)), assignments.get(1));
            assertEquals(DuplicateAssignment.unique(), assignments.get(2));
        }

        @Test
        @DisplayName("Leading whitespace moves a record to another bucket")
        void leadingWhitespaceMissesDuplicate() {
            List<DuplicateAssignment> assignments = engine.clusterDuplicates(
                    List.of(" apple pie", "apple pie"), 0.9, 2, null);

            assertTrue(engine.similarity(" apple pie", "apple pie") >= 0.9);
            assertFalse(assignments.get(0).isDuplicate());
            assertFalse(assignments.get(1).isDuplicate());
        }

        @Test
        @DisplayName("Blocking is case-insensitive")
        void caseInsensitiveBlocking() {
            List<DuplicateAssignment> assignments = engine.clusterDuplicates(
                    List.of("Apple pie", "apple pie"), 0.9, 3, null);

            assertTrue(assignments.get(0).isDuplicate());
            assertTrue(assignments.get(1).isDuplicate());
        }

        @Test
        @DisplayName("Progress callback receives a completion report")
        void reportsCompletion() {
            ProgressCallback callback = mock(ProgressCallback.class);
            engine.clusterDuplicates(PIES, 0.85, 2, callback);

            verify(callback).onProgress(3L, 3L, "Duplicate detection complete");
        }

        @ParameterizedTest
        @ValueSource(doubles = {0.49, 1.01, -1.0, Double.NaN})
        @DisplayName("Threshold outside [0.5, 1.0] is rejected")
        void invalidThreshold(double threshold) {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                    () -> engine.clusterDuplicates(PIES, threshold, 3, null));
            assertEquals("threshold", e.getParameter());
        }

        @ParameterizedTest
        @ValueSource(ints = {0, 11, -3})
        @DisplayName("Prefix length outside [1, 10] is rejected")
        void invalidPrefixLength(int prefixLength) {
            InvalidParameterException e = assertThrows(InvalidParameterException.class,
                    () -> engine.clusterDuplicates(PIES, 0.9, prefixLength, null));
            assertEquals("prefixLength", e.getParameter());
        }

        @Test
        @DisplayName("Null input is rejected")
        void nullInput() {
            assertThrows(IllegalArgumentException.class, () -> engine.clusterDuplicates(null, 0.9, 3, null));
        }
    }

    @Nested
    @DisplayName("buildBuckets and similarity")
    class BucketsAndSimilarityTests {

        @Test
        @DisplayName("Buckets cover every record exactly once")
        void bucketsCoverAllRecords() {
            Map<String, List<Integer>> buckets = engine.buildBuckets(PIES, 2);

            assertEquals(List.of("ap", "ba"), new ArrayList<>(buckets.keySet()));
            assertEquals(List.of(0, 1, 3), buckets.get("ap"));
            assertEquals(List.of(2), buckets.get("ba"));
            assertEquals(PIES.size(), buckets.values().stream().mapToInt(List::size).sum());
        }

        @Test
        @DisplayName("Similarity is symmetric and bounded")
        void similarityProperties() {
            double forward = engine.similarity("apple pie", "appel pie");
            double backward = engine.similarity("appel pie", "apple pie");

            assertEquals(forward, backward);
            assertTrue(forward > 0.95 && forward < 1.0);
            assertEquals(1.0, engine.similarity("", ""));
            assertEquals(0.0, engine.similarity("", "x"));
            assertEquals(0.0, engine.similarity("abc", "xyz"));
        }
    }

    @Nested
    @DisplayName("estimateComparisons")
    class EstimateTests {

        @Test
        @DisplayName("Reports blocked and full pairwise cost")
        void estimate() {
            ComparisonEstimate estimate = engine.estimateComparisons(PIES, 2);

            assertEquals(4, estimate.recordCount());
            assertEquals(2, estimate.bucketCount());
            assertEquals(3, estimate.comparisons());
            assertEquals(6, estimate.possibleComparisons());
            assertEquals(50.0, estimate.percentOfFull(), 1e-9);
        }

        @Test
        @DisplayName("Fewer than two records cost nothing")
        void estimateSingleRecord() {
            ComparisonEstimate estimate = engine.estimateComparisons(List.of("only"), 3);
            assertEquals(0, estimate.possibleComparisons());
            assertEquals(0.0, estimate.percentOfFull());
        }
    }

    @Nested
    @DisplayName("deduplicate")
    class DeduplicateTests {

        @Test
        @DisplayName("Result carries groups and comparison count")
        void fullResult() {
            DedupResult result = engine.deduplicate(PIES, DedupOptions.of(0.85, 2), null, null);

            assertEquals(1, result.groupCount());
            assertEquals(3, result.duplicateRecordCount());
            assertEquals(3, result.comparisons());
            assertEquals(List.of(1, 2, 4), result.groups().get(0).rowNumbers());
        }

        @Test
        @DisplayName("Null options fall back to defaults")
        void nullOptions() {
            DedupResult result = engine.deduplicate(List.of("apple pie", "apple pie"), null, null, null);
            assertEquals(1, result.groupCount());
        }

        @Test
        @DisplayName("Token-set scoring ignores extra words where Jaro-Winkler does not")
        void tokenSetScorer() {
            List<String> texts = List.of("apple pie", "apple pie fresh");

            DedupResult jaroWinkler = engine.deduplicate(texts, DedupOptions.of(0.95, 2), null, null);
            DedupResult tokenSet = engine.deduplicate(texts, DedupOptions.builder()
                    .threshold(0.95)
                    .prefixLength(2)
                    .scorerType(ScorerType.TOKEN_SET)
                    .build(), null, null);

            assertEquals(0, jaroWinkler.groupCount());
            assertEquals(1, tokenSet.groupCount());
        }

        @Test
        @DisplayName("Score cache and parallel scoring do not change the result")
        void cacheAndParallelism() {
            List<String> texts = new ArrayList<>();
            for (int i = 0; i < 30; i++) {
                texts.add(i % 3 == 0 ? "apple pie" : i % 3 == 1 ? "appel pie" : "banana split " + (i % 2));
            }
            DedupResult plain = engine.deduplicate(texts, DedupOptions.of(0.9, 2), null, null);
            DedupResult tuned = engine.deduplicate(texts, DedupOptions.builder()
                    .threshold(0.9)
                    .prefixLength(2)
                    .scoreCache(CacheConfig.defaults())
                    .parallelism(3)
                    .build(), null, null);

            assertEquals(plain.assignments(), tuned.assignments());
            assertEquals(plain.groups(), tuned.groups());
        }

        @Test
        @DisplayName("Cancelled token aborts the run")
        void cancelled() {
            CancellationToken token = CancellationToken.none();
            token.cancel();

            assertThrows(DeduplicationCancelledException.class,
                    () -> engine.deduplicate(PIES, DedupOptions.of(0.85, 2), null, token));
        }

        @Test
        @DisplayName("Metrics are recorded through Micrometer")
        void recordsMetrics() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            DeduplicationEngine metered = new DeduplicationEngine(new MicrometerMetricsService(registry));

            metered.deduplicate(PIES, DedupOptions.of(0.85, 2), null, null);

            assertEquals(3.0, registry.get("dedup.comparisons").counter().count());
            assertEquals(1.0, registry.get("dedup.groups").counter().count());
            assertEquals(1L, registry.get("dedup.run.duration").tag("mode", "sequential").timer().count());
        }
    }

    @Nested
    @DisplayName("deduplicateRecords")
    class RecordTests {

        @Test
        @DisplayName("Records are normalized before grouping")
        void groupsRecords() {
            List<Record> records = List.of(
                    Record.of(0, "John", "Smith", 42),
                    Record.of(1, "John", "Smyth", 42),
                    Record.of(2, "Mary", null, "Jones"));

            DedupResult result = engine.deduplicateRecords(records, DedupOptions.of(0.9, 3), null, null);

            assertEquals(List.of(2), result.assignmentOf(0).duplicateRows());
            assertEquals(List.of(1), result.assignmentOf(1).duplicateRows());
            assertFalse(result.assignmentOf(2).isDuplicate());
        }

        @Test
        @DisplayName("Records out of position are rejected")
        void indexMismatch() {
            List<Record> records = List.of(Record.of(1, "a"), Record.of(0, "b"));
            assertThrows(IllegalArgumentException.class,
                    () -> engine.deduplicateRecords(records, DedupOptions.defaults(), null, null));
        }
    }
}
