package com.corpussearch.scoring;

import com.corpussearch.storage.Posting;

/**
 * 逐文档打分接口。
 *
 * 查询引擎对每个候选文档先调用一次 {@link #reset}，再对每个命中的查询词调用一次 {@link #update}，
 * 最后调用 {@link #evaluate} 取得得分。得分按词项累加，与 update 的调用顺序无关。
 * 实例带状态，不能在并发查询之间共享。
 */
public interface Ranker {

    /**
     * 开始为指定文档打分，清空上一个文档的状态。
     */
    void reset(int documentId);

    /**
     * 累加一个命中的查询词。
     *
     * @param term 查询词
     * @param multiplicity 该词在查询中出现的次数
     * @param posting 该词在当前文档中的倒排项
     */
    void update(String term, int multiplicity, Posting posting);

    /**
     * 返回当前文档的最终得分。
     */
    double evaluate();
}
