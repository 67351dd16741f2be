package com.corpussearch.storage;

import java.util.Iterator;

/**
 * 单个词项的倒排列表，按文档ID严格递增。
 *
 * 构建索引期间只允许追加，构建完成后只读。
 */
public interface PostingList extends Iterable<Posting> {

    /**
     * 追加一条倒排项，文档ID必须大于已有的最后一个文档ID。
     *
     * @param posting 倒排项
     * @throws IllegalArgumentException 如果文档ID未严格递增
     */
    void appendPosting(Posting posting);

    /**
     * 返回倒排项数量，即该词项的文档频率。
     */
    int size();

    /**
     * 结束构建，返回只读的等价列表，之后的追加抛出 IllegalStateException。
     * 冻结后的列表可被多个线程同时遍历。
     */
    PostingList freeze();

    /**
     * 按文档ID升序遍历倒排项。
     */
    @Override
    Iterator<Posting> iterator();
}
