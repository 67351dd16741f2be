package com.corpussearch.document;

/**
 * 文档集合，按文档ID升序遍历。文档ID在 [0, size) 内稠密分配。
 */
public interface Corpus extends Iterable<Document> {

    /**
     * 文档总数。
     */
    int size();

    /**
     * 按ID获取文档。
     *
     * @throws IllegalArgumentException 文档不存在
     */
    Document getDocument(int docId);
}
