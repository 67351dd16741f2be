package com.corpussearch.text;

/**
 * 分词结果。
 *
 * @param term 词项原文（未归一化）
 * @param startOffset 在输入文本中的起始偏移（含）
 * @param endOffset 在输入文本中的结束偏移（不含）
 */
public record Token(
    String term,
    int startOffset,
    int endOffset
) {
}
