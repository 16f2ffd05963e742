package com.segmentengine.config;

/**
 * 全局常量定义
 * 
 * 包含段文件格式魔数、文件命名、构建与合并参数以及内存估算常量
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 段文件格式魔数 ====================
    /** 词典文件魔数 "SGTD" */
    public static final int TERMS_MAGIC = 0x53475444;
    /** 倒排列表文件魔数 "SGPI" */
    public static final int POSTINGS_MAGIC = 0x53475049;
    /** 位置表文件魔数 "SGPS" */
    public static final int POSITIONS_MAGIC = 0x53475053;
    /** 文档存储文件魔数 "SGDS" */
    public static final int DOCS_MAGIC = 0x53474453;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    
    // ==================== 文件命名 ====================
    /** 段目录前缀 */
    public static final String SEGMENT_DIR_PREFIX = "seg-";
    /** 写入中的段目录后缀，发布时原子重命名去掉 */
    public static final String TEMP_SUFFIX = ".tmp";
    public static final String TERMS_FILE = "terms.dict";
    public static final String POSTINGS_FILE = "postings.inv";
    public static final String POSITIONS_FILE = "positions.pos";
    public static final String DOCS_FILE = "docs.dat";
    public static final String SEGMENT_META_FILE = "segment.json";
    /** 段集合清单文件 */
    public static final String MANIFEST_FILE = "segments.json";
    /** 索引级选项文件 */
    public static final String INDEX_OPTIONS_FILE = "index-options.json";
    
    // ==================== 构建参数 ====================
    /** 进度日志间隔行数 */
    public static final long PROGRESS_LOG_INTERVAL_ROWS = 100_000L;
    /** 进度汇总线程轮询间隔（毫秒） */
    public static final long PROGRESS_POLL_INTERVAL_MS = 200L;
    /** 语句级默认并行度 */
    public static final int DEFAULT_STATEMENT_PARALLELISM = 1;
    /** 语句级默认单 worker 内存预算（MB） */
    public static final int DEFAULT_STATEMENT_MEMORY_BUDGET_MB = 15;
    /** 维护内存默认值（MB），用于推导未显式设置的预算 */
    public static final int DEFAULT_MAINTENANCE_WORK_MEM_MB = 64;
    /** 推导预算的下限（MB） */
    public static final int MIN_DERIVED_MEMORY_BUDGET_MB = 1;
    /** 语句默认开启插入即合并 */
    public static final boolean DEFAULT_MERGE_ON_INSERT = true;
    /** 作业结束时等待 worker 退出的时间（秒） */
    public static final long WORKER_SHUTDOWN_TIMEOUT_SECONDS = 30L;
    
    // ==================== 内存估算 ====================
    public static final long BYTES_PER_MB = 1024L * 1024L;
    /** 对象头 */
    public static final int OBJECT_HEADER_BYTES = 16;
    /** 对象引用 */
    public static final int REFERENCE_BYTES = 8;
    /** 数组头 */
    public static final int ARRAY_HEADER_BYTES = 16;
    /** HashMap 单个条目（Node + 桶槽位） */
    public static final int HASH_ENTRY_BYTES = 48;
    /** String 对象本身（不含字符数组内容） */
    public static final int STRING_HEADER_BYTES = 40;
    /** 倒排缓冲初始容量 */
    public static final int INITIAL_POSTING_CAPACITY = 4;
}
