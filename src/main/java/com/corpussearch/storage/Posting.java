package com.corpussearch.storage;

/**
 * 倒排项：某个词项在某篇文档中的出现次数。
 *
 * @param documentId 文档ID，非负
 * @param termFrequency 词频，至少为1
 */
public record Posting(int documentId, int termFrequency) {
    public Posting {
        if (documentId < 0) {
            throw new IllegalArgumentException("documentId不能为负数: " + documentId);
        }
        if (termFrequency < 1) {
            throw new IllegalArgumentException("termFrequency必须至少为1: " + termFrequency);
        }
    }
}
