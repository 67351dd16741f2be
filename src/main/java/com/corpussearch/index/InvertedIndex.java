package com.corpussearch.index;

import com.corpussearch.storage.Posting;

import java.util.Iterator;
import java.util.List;

/**
 * 倒排索引，构建完成后只读，可被任意多个查询并发读取。
 */
public interface InvertedIndex {

    /**
     * 按构建索引时相同的归一化与分词流程处理文本。查询与文档必须经过同一流程，词项才能对齐。
     *
     * @param text 任意文本
     * @return 归一化后的词项序列，保留重复
     */
    List<String> getTerms(String text);

    /**
     * 返回词项倒排列表的迭代器，按文档ID升序。未收录的词项返回空迭代器。
     */
    Iterator<Posting> getPostingsIterator(String term);

    /**
     * 包含该词项的文档数，未收录的词项为0。
     */
    int getDocumentFrequency(String term);

    /**
     * 词项是否至少出现在一篇文档中。
     */
    default boolean contains(String term) {
        return getDocumentFrequency(term) > 0;
    }

    /**
     * 词典大小。
     */
    int getTermCount();
}
