package com.segmentengine;

import com.segmentengine.config.EngineConfig;
import com.segmentengine.document.Row;
import com.segmentengine.index.IndexManager;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * 建索引与语句级增量的性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms2g", "-Xmx2g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @Param({"1", "4"})
    int parallelism;

    Path tempDir;
    IndexManager indexManager;
    List<Row> rows;

    @Setup
    public void setup() throws IOException {
        tempDir = Files.createTempDirectory("benchmark");
        EngineConfig config = EngineConfig.defaults();
        config.setIndexDir(tempDir.resolve("index"));
        config.setCreateIndexParallelism(parallelism);
        config.setCreateIndexMemoryBudgetMb(4);
        indexManager = new IndexManager(config);

        // 生成 10000 行测试数据
        rows = new ArrayList<>(10_000);
        for (int i = 0; i < 10_000; i++) {
            rows.add(Row.of(i + 1, "key-" + i, generateDocument(i)));
        }
    }

    @TearDown
    public void tearDown() throws IOException {
        if (indexManager != null) {
            indexManager.close();
        }
        try (Stream<Path> walk = Files.walk(tempDir)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static String generateDocument(int index) {
        return "Document " + index + " content. "
            + "It contains various words like Java, segment, merge, "
            + "parallel, budget, flush, index, document, worker. "
            + "并行构建 全文索引 段合并 " + (index % 97);
    }

    @Benchmark
    public int createIndexThroughput() throws IOException {
        return indexManager.createIndex(() -> rows).size();
    }

    @Benchmark
    public int singleRowStatement() throws IOException {
        return indexManager.insert(List.of(Row.of(rows.size() + 1L, "key-extra", "single row statement"))).size();
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
