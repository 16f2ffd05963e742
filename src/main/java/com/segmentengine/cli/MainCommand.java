package com.segmentengine.cli;

import com.segmentengine.config.EngineConfig;
import com.segmentengine.config.IndexOptions;
import com.segmentengine.document.HostTable;
import com.segmentengine.document.Row;
import com.segmentengine.index.IndexManager;
import com.segmentengine.index.IndexStatus;
import com.segmentengine.index.SegmentSet;
import com.segmentengine.index.VacuumResult;
import com.segmentengine.storage.SegmentMeta;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "segidx",
    description = "🗂️ 并行分段全文索引构建与合并引擎",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.CreateIndexSubcommand.class,
        MainCommand.InsertSubcommand.class,
        MainCommand.VacuumSubcommand.class,
        MainCommand.AlterSubcommand.class,
        MainCommand.StatusSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--index-dir"}, description = "索引目录路径", defaultValue = "./index")
    private Path indexDir;

    @Option(names = {"--db"}, description = "宿主表数据库路径", defaultValue = "./rows.db")
    private Path dbPath;

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🗂️ 并行分段全文索引构建与合并引擎");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 加载配置文件（未指定时使用默认值），命令行上的索引目录优先。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        config.setIndexDir(indexDir);
        return config.validate();
    }

    @Command(name = "create-index", description = "🚀 扫描宿主表并行构建全部段")
    static class CreateIndexSubcommand implements Callable<Integer> {

        @Option(names = {"--parallelism"}, description = "建索引并行度，0 表示自动")
        private Integer parallelism;

        @Option(names = {"--memory-budget-mb"}, description = "单 worker 内存预算（MB），0 表示由维护内存推导")
        private Integer memoryBudgetMb;

        @Option(names = {"--progress"}, description = "输出建索引进度日志")
        private boolean progress;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                if (parallelism != null) {
                    config.setCreateIndexParallelism(parallelism);
                }
                if (memoryBudgetMb != null) {
                    config.setCreateIndexMemoryBudgetMb(memoryBudgetMb);
                }
                if (progress) {
                    config.setLogCreateIndexProgress(true);
                }
                System.out.println("🚀 开始建索引...");
                System.out.println("📁 索引目录: " + config.getIndexDir());
                System.out.println("🗄️ 宿主表: " + main.dbPath);

                try (HostTable hostTable = new HostTable(main.dbPath);
                     IndexManager indexManager = new IndexManager(config)) {
                    long start = System.currentTimeMillis();
                    SegmentSet segments = indexManager.createIndex(hostTable);
                    long elapsed = System.currentTimeMillis() - start;
                    System.out.println("✅ 建索引完成！");
                    System.out.println("📊 统计:");
                    System.out.println("   文档数: " + segments.docCount());
                    System.out.println("   段数量: " + segments.size());
                    System.out.println("   用时: " + elapsed + "ms");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 建索引失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "insert", description = "➕ 向宿主表插入一行并作为一条语句增量索引")
    static class InsertSubcommand implements Callable<Integer> {

        @Option(names = {"--key"}, description = "键字段值", required = true)
        private String key;

        @Option(names = {"--title"}, description = "标题")
        private String title;

        @Option(names = {"--body"}, description = "正文", required = true)
        private String body;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (HostTable hostTable = new HostTable(main.dbPath);
                 IndexManager indexManager = new IndexManager(main.resolveConfig())) {
                Row row = hostTable.insert(key, title, body);
                List<SegmentMeta> added = indexManager.insert(List.of(row));
                IndexStatus status = indexManager.getStatus();
                System.out.println("✅ 已插入 rowId=" + row.rowId() + "，新增段 " + added.size() + " 个");
                System.out.println("📦 当前段数量: " + status.segmentCount());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 插入失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "vacuum", description = "🧹 合并到目标段数并回收无用段文件")
    static class VacuumSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (IndexManager indexManager = new IndexManager(main.resolveConfig())) {
                VacuumResult result = indexManager.vacuumAsync().join();
                System.out.println("✅ 维护完成！");
                System.out.println("📦 段数量: " + result.segments().size());
                System.out.println("🔀 执行合并: " + (result.merged() ? "是" : "否"));
                System.out.println("🗑️ 回收段目录: " + result.reclaimedSegments());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 维护失败: " + exception.getMessage());
                exception.printStackTrace();
                return 1;
            }
        }
    }

    @Command(name = "alter", description = "🔧 修改索引合并选项")
    static class AlterSubcommand implements Callable<Integer> {

        @Option(names = {"--target-segment-count"}, description = "目标段数，0 表示按主机处理器数")
        private Integer targetSegmentCount;

        @Option(names = {"--merge-on-insert"}, description = "插入后是否同步合并 (true|false)", arity = "1")
        private Boolean mergeOnInsert;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            if (targetSegmentCount == null && mergeOnInsert == null) {
                System.out.println("⚠️ 未指定任何选项，使用 --target-segment-count 或 --merge-on-insert");
                return 1;
            }
            try (IndexManager indexManager = new IndexManager(main.resolveConfig())) {
                IndexOptions options = indexManager.alterOptions(targetSegmentCount, mergeOnInsert);
                System.out.println("✅ 索引选项已更新");
                System.out.println("🎯 目标段数: " + options.targetSegmentCount());
                System.out.println("🔀 插入即合并: " + options.mergeOnInsert());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 修改选项失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "status", description = "📊 查看索引统计信息")
    static class StatusSubcommand implements Callable<Integer> {

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try (IndexManager indexManager = new IndexManager(main.resolveConfig())) {
                IndexStatus status = indexManager.getStatus();

                System.out.println("📊 索引状态");
                System.out.println("═══════════");
                System.out.println("📁 索引目录: " + main.indexDir);
                System.out.println("📄 文档总数: " + status.docCount());
                System.out.println("📦 段数量: " + status.segmentCount());
                System.out.println("💾 索引大小: " + formatBytes(status.sizeBytes()));
                System.out.println("🗑️ 待回收段: " + status.pendingDeletes());
                System.out.println("🎯 目标段数: " + status.options().targetSegmentCount());
                System.out.println("🔀 插入即合并: " + status.options().mergeOnInsert());
                System.out.println("🔢 版本: " + status.version());
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取状态失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }
}
