package com.ngramengine;

import com.ngramengine.index.IndexStore;
import com.ngramengine.index.NgramIndex;
import com.ngramengine.index.NgramIndexBuilder;
import com.ngramengine.storage.ItemIdCodec;
import com.ngramengine.vector.SparseVector;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 构建与查询性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class QueryBenchmark {

    private static final String[] STEMS = {
        "school", "music", "kinder", "garten", "muskel", "search", "index", "engine", "vector", "gram"
    };

    static String generateTerm(int index) {
        return STEMS[index % STEMS.length] + STEMS[(index / STEMS.length) % STEMS.length] + index;
    }

    static NgramIndex<Integer> buildIndex(int termCount) {
        NgramIndexBuilder<Integer> builder = new NgramIndexBuilder<>(3);
        for (int i = 0; i < termCount; i++) {
            builder.insert(generateTerm(i), i);
        }
        return builder.build();
    }

    @Benchmark
    public NgramIndex<Integer> buildThroughput() {
        // 每次构建1000个词项
        return buildIndex(1000);
    }

    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    @State(Scope.Benchmark)
    public static class QueryLatencyState {
        NgramIndex<Integer> index;
        SparseVector query;

        @Setup
        public void setup() {
            index = buildIndex(100_000);
            query = index.makeQueryVector("shoolmusik").orElseThrow();
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long queryLatencyFind(QueryLatencyState state) {
        return state.index.find(state.query).count();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public long queryLatencyFindFast(QueryLatencyState state) {
        return state.index.findFast(state.query, 1000).count();
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MICROSECONDS)
    public int queryLatencySearch(QueryLatencyState state) {
        return state.index.search("shoolmusik", 10).hits().size();
    }

    @State(Scope.Benchmark)
    public static class PersistenceState {
        Path tempDir;
        NgramIndex<Integer> index;

        @Setup
        public void setup() throws IOException {
            tempDir = Files.createTempDirectory("benchmark");
            index = buildIndex(10_000);
        }

        @TearDown
        public void tearDown() throws IOException {
            try (Stream<Path> paths = Files.walk(tempDir)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(path);
                }
            }
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.MILLISECONDS)
    public int saveAndLoad(PersistenceState state) throws IOException {
        Path indexDir = state.tempDir.resolve("index");
        IndexStore.save(state.index, indexDir, ItemIdCodec.INTEGER);
        return IndexStore.load(indexDir, ItemIdCodec.INTEGER).size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(QueryBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
