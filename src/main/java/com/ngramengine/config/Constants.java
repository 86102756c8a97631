package com.ngramengine.config;

/**
 * 全局常量定义
 * 
 * 包含索引文件格式魔数、n-gram 切分参数与查询剪枝默认值
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式 ====================
    /** 索引文件魔数 "NGIX" */
    public static final int INDEX_MAGIC = 0x4E474958;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    /** 二进制索引文件名 */
    public static final String INDEX_FILE_NAME = "index.ngi";
    /** 元数据 JSON 文件名 */
    public static final String META_FILE_NAME = "index.meta.json";

    // ==================== n-gram参数 ====================
    /** 填充哨兵字符，位于常规词项字母表之外 */
    public static final char SENTINEL = '§';
    /** 默认 gram 长度 */
    public static final int DEFAULT_GRAM_LENGTH = 3;

    // ==================== 查询参数 ====================
    /** 加权查询未指定阈值时的文档频率上限 */
    public static final int DEFAULT_TF_THRESHOLD = 1000;
    /** 与普通 Dice 等价的权重 */
    public static final double BALANCED_WEIGHT = 0.5;
    /** 默认返回结果数 */
    public static final int DEFAULT_QUERY_LIMIT = 10;
    /** 单次查询返回结果数上限 */
    public static final int MAX_SEARCH_LIMIT = 10_000;
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 1024;
}
