package com.corpussearch.query;

import java.util.List;

/**
 * @param hits 排序后的结果，最多 hitCount 条
 * @param totalMatches 达到匹配阈值的候选文档总数
 * @param elapsedMs 查询耗时
 * @param query 原始查询
 */
public record SearchResult(
        List<SearchHit> hits,
        int totalMatches,
        long elapsedMs,
        String query
) {
}
