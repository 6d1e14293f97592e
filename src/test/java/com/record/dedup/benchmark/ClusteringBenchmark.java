package com.record.dedup.benchmark;

import com.record.dedup.api.DedupOptions;
import com.record.dedup.api.DeduplicationEngine;
import com.record.dedup.core.model.DedupResult;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * JMH benchmarks for the blocking and clustering pipeline.
 * Run with: java -cp target/test-classes:target/classes:... org.openjdk.jmh.Main ClusteringBenchmark
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MILLISECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 2, time = 1)
@Measurement(iterations = 3, time = 1)
@Fork(1)
public class ClusteringBenchmark {

    @Param({"1000", "5000"})
    private int recordCount;

    @Param({"1", "3"})
    private int prefixLength;

    private DeduplicationEngine engine;
    private List<String> texts;

    @Setup(Level.Trial)
    public void setup() {
        engine = new DeduplicationEngine();
        texts = generateNames(recordCount, new Random(7));
    }

    @Benchmark
    public void sequential(Blackhole bh) {
        DedupResult result = engine.deduplicate(texts, DedupOptions.of(0.9, prefixLength), null, null);
        bh.consume(result);
    }

    @Benchmark
    public void parallel(Blackhole bh) {
        DedupOptions options = DedupOptions.builder()
                .threshold(0.9)
                .prefixLength(prefixLength)
                .parallelism(4)
                .build();
        bh.consume(engine.deduplicate(texts, options, null, null));
    }

    static List<String> generateNames(int count, Random random) {
        String[] first = {"john", "mary", "james", "patricia", "robert", "jennifer", "michael", "linda"};
        String[] last = {"smith", "johnson", "williams", "brown", "jones", "garcia", "miller", "davis"};
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            StringBuilder name = new StringBuilder()
                    .append(first[random.nextInt(first.length)]).append(' ')
                    .append(last[random.nextInt(last.length)]).append(' ')
                    .append(random.nextInt(100));
            if (random.nextInt(4) == 0) {
                int pos = 1 + random.nextInt(name.length() - 1);
                name.setCharAt(pos, (char) ('a' + random.nextInt(26)));
            }
            names.add(name.toString());
        }
        return names;
    }
}
