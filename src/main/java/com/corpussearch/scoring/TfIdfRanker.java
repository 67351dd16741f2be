package com.corpussearch.scoring;

import com.corpussearch.config.Constants;
import com.corpussearch.config.EngineConfig;
import com.corpussearch.document.Corpus;
import com.corpussearch.document.Document;
import com.corpussearch.index.InvertedIndex;
import com.corpussearch.storage.Posting;

/**
 * TF-IDF 排序，并叠加与查询无关的静态质量分。
 *
 * score(q, d) = w_dynamic × Σ tf(t, d) × ln(N / df(t)) + w_static × quality(d)
 *
 * 静态质量分从文档字段读取，字段缺失时取 0.0。
 * 文档总数 N 在构造时读取一次，语料库在索引构建后不应再变化。
 */
public class TfIdfRanker implements Ranker {
    private final Corpus corpus;
    private final InvertedIndex invertedIndex;
    private final int documentCount;
    private final String staticQualityField;
    private final double dynamicScoreWeight;
    private final double staticScoreWeight;

    private int documentId = -1;
    private double dynamicScore;

    public TfIdfRanker(Corpus corpus, InvertedIndex invertedIndex) {
        this(corpus, invertedIndex, EngineConfig.defaults());
    }

    public TfIdfRanker(Corpus corpus, InvertedIndex invertedIndex, EngineConfig config) {
        if (corpus == null || invertedIndex == null || config == null) {
            throw new IllegalArgumentException("corpus、invertedIndex与config不能为null");
        }
        this.corpus = corpus;
        this.invertedIndex = invertedIndex;
        this.documentCount = corpus.size();
        this.staticQualityField = config.getStaticQualityField();
        this.dynamicScoreWeight = config.getDynamicScoreWeight();
        this.staticScoreWeight = config.getStaticScoreWeight();
    }

    @Override
    public void reset(int documentId) {
        this.documentId = documentId;
        this.dynamicScore = 0.0;
    }

    @Override
    public void update(String term, int multiplicity, Posting posting) {
        RankerChecks.requireSameDocument(documentId, posting);
        // df至少为1：该词至少命中了当前文档
        int documentFrequency = invertedIndex.getDocumentFrequency(term);
        if (documentFrequency < 1) {
            throw new IllegalStateException("词项未收录却产生了命中: " + term);
        }
        double idf = Math.log((double) documentCount / documentFrequency);
        dynamicScore += posting.termFrequency() * idf;
    }

    @Override
    public double evaluate() {
        RankerChecks.requireReset(documentId);
        Document document = corpus.getDocument(documentId);
        return dynamicScoreWeight * dynamicScore + staticScoreWeight * staticQuality(document);
    }

    private double staticQuality(Document document) {
        Object value = document.getField(staticQualityField, Constants.DEFAULT_STATIC_QUALITY_SCORE);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = value.toString().trim();
        if (text.isEmpty()) {
            return Constants.DEFAULT_STATIC_QUALITY_SCORE;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException exception) {
            throw new IllegalArgumentException("静态质量分不是数字: docId=" + document.docId()
                + ", " + staticQualityField + "=" + text, exception);
        }
    }
}
