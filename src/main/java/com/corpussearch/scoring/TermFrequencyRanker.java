package com.corpussearch.scoring;

import com.corpussearch.storage.Posting;

/**
 * 最简单的排序：得分为各命中词的 查询次数 × 文档词频 之和。
 */
public class TermFrequencyRanker implements Ranker {
    private int documentId = -1;
    private double score;

    @Override
    public void reset(int documentId) {
        this.documentId = documentId;
        this.score = 0.0;
    }

    @Override
    public void update(String term, int multiplicity, Posting posting) {
        RankerChecks.requireSameDocument(documentId, posting);
        score += (double) multiplicity * posting.termFrequency();
    }

    @Override
    public double evaluate() {
        RankerChecks.requireReset(documentId);
        return score;
    }
}
