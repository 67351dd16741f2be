package com.corpussearch.query;

import com.corpussearch.config.Constants;
import com.corpussearch.config.EngineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SearchOptionsTest {

    @ParameterizedTest
    @CsvSource({
        "1.0, 1, 1",
        "1.0, 3, 3",
        "0.5, 2, 1",
        "0.5, 3, 2",
        "0.34, 3, 2",
        "0.01, 3, 1",
        "0.7, 10, 7",
        "0.3, 10, 3",
        "0.999, 4, 4"
    })
    @DisplayName("N = max(1, min(M, ceil(threshold × M)))")
    void testRequiredMatches(double threshold, int distinctTerms, int expected) {
        SearchOptions options = new SearchOptions(threshold, 10);

        assertEquals(expected, options.requiredMatches(distinctTerms));
    }

    @Test
    @DisplayName("M为0时N为0")
    void testRequiredMatchesForEmptyQuery() {
        assertEquals(0, SearchOptions.defaults().requiredMatches(0));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.5, 1.0000001, 2.0, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("匹配比例不在(0, 1]内时拒绝，不做截断")
    void testRejectInvalidThreshold(double threshold) {
        assertThrows(IllegalArgumentException.class, () -> new SearchOptions(threshold, 10));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1})
    @DisplayName("结果数小于1时拒绝")
    void testRejectInvalidHitCount(int hitCount) {
        assertThrows(IllegalArgumentException.class, () -> new SearchOptions(0.5, hitCount));
    }

    @Test
    @DisplayName("默认值与配置")
    void testDefaultsAndConfig() {
        SearchOptions defaults = SearchOptions.defaults();
        assertEquals(Constants.DEFAULT_MATCH_THRESHOLD, defaults.matchThreshold());
        assertEquals(Constants.DEFAULT_HIT_COUNT, defaults.hitCount());

        EngineConfig config = EngineConfig.defaults();
        config.setMatchThreshold(0.8);
        config.setHitCount(3);
        assertEquals(new SearchOptions(0.8, 3), SearchOptions.fromConfig(config));

        config.setHitCount(0);
        assertThrows(IllegalArgumentException.class, () -> SearchOptions.fromConfig(config));
    }
}
