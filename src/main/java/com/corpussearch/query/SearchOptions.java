package com.corpussearch.query;

import com.corpussearch.config.Constants;
import com.corpussearch.config.EngineConfig;

/**
 * 单次查询的参数。
 *
 * @param matchThreshold 匹配比例，取值 (0, 1]；M 个不同查询词中至少命中 ceil(matchThreshold × M) 个
 * @param hitCount 最多返回的结果数，至少为1
 */
public record SearchOptions(double matchThreshold, int hitCount) {
    public SearchOptions {
        if (Double.isNaN(matchThreshold) || matchThreshold <= 0.0 || matchThreshold > 1.0) {
            throw new IllegalArgumentException("matchThreshold必须在(0, 1]之间: " + matchThreshold);
        }
        if (hitCount < 1) {
            throw new IllegalArgumentException("hitCount必须至少为1: " + hitCount);
        }
    }

    public static SearchOptions defaults() {
        return new SearchOptions(Constants.DEFAULT_MATCH_THRESHOLD, Constants.DEFAULT_HIT_COUNT);
    }

    public static SearchOptions fromConfig(EngineConfig config) {
        return new SearchOptions(config.getMatchThreshold(), config.getHitCount());
    }

    /**
     * 由不同查询词个数 M 计算需要命中的词数 N，保证 1 ≤ N ≤ M（M 为0时返回0）。
     */
    public int requiredMatches(int distinctTerms) {
        if (distinctTerms <= 0) {
            return 0;
        }
        int required = (int) Math.ceil(matchThreshold * distinctTerms - Constants.MATCH_THRESHOLD_EPSILON);
        return Math.max(1, Math.min(distinctTerms, required));
    }
}
