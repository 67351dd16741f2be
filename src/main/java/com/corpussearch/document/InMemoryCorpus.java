package com.corpussearch.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 全部保存在内存中的语料库。
 */
public class InMemoryCorpus implements Corpus {
    private final List<Document> documents = new ArrayList<>();

    /**
     * 追加文档并分配下一个文档ID。
     *
     * @param fields 文档字段
     * @return 新文档
     */
    public Document addDocument(Map<String, Object> fields) {
        Document document = new Document(documents.size(), fields);
        documents.add(document);
        return document;
    }

    @Override
    public int size() {
        return documents.size();
    }

    @Override
    public Document getDocument(int docId) {
        if (docId < 0 || docId >= documents.size()) {
            throw new IllegalArgumentException("文档不存在: docId=" + docId);
        }
        return documents.get(docId);
    }

    @Override
    public Iterator<Document> iterator() {
        return Collections.unmodifiableList(documents).iterator();
    }
}
