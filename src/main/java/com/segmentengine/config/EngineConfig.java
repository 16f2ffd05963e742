package com.segmentengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 引擎运行时配置
 * 
 * 支持从CLI参数或JSON配置文件注入，覆盖Constants默认值。
 * 取值由外部设置层负责权限校验，引擎只在作业启动前做范围校验。
 */
public class EngineConfig {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Path indexDir = Paths.get("./index");
    /** 建索引并行度，0 表示按主机可用处理器数自动选择 */
    private int createIndexParallelism = 0;
    /** 建索引单 worker 内存预算（MB），0 表示由维护内存推导 */
    private int createIndexMemoryBudgetMb = 0;
    private int statementParallelism = Constants.DEFAULT_STATEMENT_PARALLELISM;
    private int statementMemoryBudgetMb = Constants.DEFAULT_STATEMENT_MEMORY_BUDGET_MB;
    private int maintenanceWorkMemMb = Constants.DEFAULT_MAINTENANCE_WORK_MEM_MB;
    private boolean logCreateIndexProgress = false;
    
    public Path getIndexDir() {
        return indexDir;
    }
    
    public void setIndexDir(Path indexDir) {
        this.indexDir = indexDir;
    }
    
    public int getCreateIndexParallelism() {
        return createIndexParallelism;
    }
    
    public void setCreateIndexParallelism(int createIndexParallelism) {
        this.createIndexParallelism = createIndexParallelism;
    }
    
    public int getCreateIndexMemoryBudgetMb() {
        return createIndexMemoryBudgetMb;
    }
    
    public void setCreateIndexMemoryBudgetMb(int createIndexMemoryBudgetMb) {
        this.createIndexMemoryBudgetMb = createIndexMemoryBudgetMb;
    }
    
    public int getStatementParallelism() {
        return statementParallelism;
    }
    
    public void setStatementParallelism(int statementParallelism) {
        this.statementParallelism = statementParallelism;
    }
    
    public int getStatementMemoryBudgetMb() {
        return statementMemoryBudgetMb;
    }
    
    public void setStatementMemoryBudgetMb(int statementMemoryBudgetMb) {
        this.statementMemoryBudgetMb = statementMemoryBudgetMb;
    }
    
    public int getMaintenanceWorkMemMb() {
        return maintenanceWorkMemMb;
    }
    
    public void setMaintenanceWorkMemMb(int maintenanceWorkMemMb) {
        this.maintenanceWorkMemMb = maintenanceWorkMemMb;
    }
    
    public boolean isLogCreateIndexProgress() {
        return logCreateIndexProgress;
    }
    
    public void setLogCreateIndexProgress(boolean logCreateIndexProgress) {
        this.logCreateIndexProgress = logCreateIndexProgress;
    }
    
    /**
     * 校验全部取值范围，非法时抛出 {@link ConfigurationException}。
     *
     * @return 当前实例
     */
    public EngineConfig validate() {
        ConfigurationException.requireNonNegative("createIndexParallelism", createIndexParallelism);
        ConfigurationException.requireNonNegative("createIndexMemoryBudgetMb", createIndexMemoryBudgetMb);
        ConfigurationException.requireNonNegative("statementParallelism", statementParallelism);
        ConfigurationException.requireNonNegative("statementMemoryBudgetMb", statementMemoryBudgetMb);
        ConfigurationException.requirePositive("maintenanceWorkMemMb", maintenanceWorkMemMb);
        if (indexDir == null) {
            throw new ConfigurationException("indexDir 不能为空");
        }
        return this;
    }
    
    /**
     * 使用默认配置创建实例
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * 从 JSON 配置文件加载，缺省字段保留默认值。
     *
     * @param configFile 配置文件
     * @return 校验后的配置
     * @throws IOException 读取或解析失败时抛出
     */
    public static EngineConfig load(Path configFile) throws IOException {
        if (configFile == null) {
            throw new IllegalArgumentException("配置文件不能为空");
        }
        if (!Files.isRegularFile(configFile)) {
            throw new IOException("配置文件不存在: " + configFile.toAbsolutePath());
        }
        EngineConfig config;
        try {
            config = OBJECT_MAPPER.readValue(configFile.toFile(), EngineConfig.class);
        } catch (IOException exception) {
            throw new IOException("读取引擎配置失败: " + configFile.toAbsolutePath(), exception);
        }
        return config.validate();
    }
}
