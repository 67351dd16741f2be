package com.corpussearch.config;

import java.util.List;

/**
 * 全局常量定义
 *
 * 包含检索默认参数、排序参数与命令行限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 检索参数 ====================
    /** 默认匹配比例，M个查询词中至少命中 ceil(0.5 * M) 个 */
    public static final double DEFAULT_MATCH_THRESHOLD = 0.5;
    /** 默认返回结果数量 */
    public static final int DEFAULT_HIT_COUNT = 10;
    /** 计算 ceil(threshold * M) 时吸收浮点误差 */
    public static final double MATCH_THRESHOLD_EPSILON = 1e-9;

    // ==================== 索引参数 ====================
    /** 默认索引字段 */
    public static final List<String> DEFAULT_FIELDS = List.of("body");
    /** 默认不使用shingle分词 */
    public static final int DEFAULT_SHINGLE_WIDTH = 0;

    // ==================== 排序参数 ====================
    /** 静态质量分字段名 */
    public static final String STATIC_QUALITY_FIELD = "static_quality_score";
    /** 静态质量分缺失时的默认值 */
    public static final double DEFAULT_STATIC_QUALITY_SCORE = 0.0;
    /** 查询相关得分权重 */
    public static final double DYNAMIC_SCORE_WEIGHT = 1.0;
    /** 静态质量分权重 */
    public static final double STATIC_SCORE_WEIGHT = 1.0;

    // ==================== 命令行参数 ====================
    /** 查询字符串最大长度 */
    public static final int MAX_QUERY_LENGTH = 1024;
    /** 以这些扩展名结尾的语料路径按 SQLite 文档表打开 */
    public static final List<String> DATABASE_EXTENSIONS = List.of(".db", ".sqlite");
}
