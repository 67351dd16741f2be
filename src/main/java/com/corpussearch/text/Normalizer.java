package com.corpussearch.text;

/**
 * 文本归一化。索引构建与查询必须使用同一个实例，保证词项一致。
 */
public interface Normalizer {

    /**
     * 分词前对整段文本做规范化。
     */
    String canonicalize(String buffer);

    /**
     * 分词后对单个词项做归一化。
     */
    String normalize(String token);
}
