package com.corpussearch.query;

import com.corpussearch.document.Corpus;
import com.corpussearch.index.InvertedIndex;
import com.corpussearch.scoring.Ranker;
import com.corpussearch.storage.Posting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Supplier;

/**
 * 基于倒排索引的 N-out-of-M 排序检索，适用于小型语料库。
 *
 * 查询含 M 个不同词项时，文档至少包含其中 N ≤ M 个才算命中。命中文档按文档ID升序逐个
 * （document-at-a-time）交给 Ranker 打分，再由 Sieve 保留得分最高的 hitCount 条。
 *
 * 每次调用的状态都在调用内部，索引与语料库只读，多个查询可并发执行，各自使用独立的 Ranker。
 */
public class SimpleSearchEngine {
    private static final Logger logger = LoggerFactory.getLogger(SimpleSearchEngine.class);

    private final Corpus corpus;
    private final InvertedIndex invertedIndex;

    public SimpleSearchEngine(Corpus corpus, InvertedIndex invertedIndex) {
        if (corpus == null || invertedIndex == null) {
            throw new IllegalArgumentException("corpus与invertedIndex不能为null");
        }
        this.corpus = corpus;
        this.invertedIndex = invertedIndex;
    }

    /**
     * 惰性执行查询。参数在调用时立即校验，合并与打分推迟到第一次访问返回的迭代器时才进行。
     *
     * @param query 查询文本
     * @param options 匹配比例与结果数
     * @param ranker 打分器，调用期间不能与其他查询共享
     * @return 按得分降序的结果，只能遍历一次
     */
    public Iterator<SearchHit> evaluate(String query, SearchOptions options, Ranker ranker) {
        validate(options, ranker);
        return new LazyHitIterator(() -> run(query, options, ranker).hits());
    }

    /**
     * 立即执行查询并返回完整结果与统计。
     */
    public SearchResult search(String query, SearchOptions options, Ranker ranker) {
        validate(options, ranker);
        long startNanos = System.nanoTime();
        Evaluation evaluation = run(query, options, ranker);
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        return new SearchResult(evaluation.hits(), evaluation.candidates(), elapsedMs, query);
    }

    private void validate(SearchOptions options, Ranker ranker) {
        if (options == null) {
            throw new IllegalArgumentException("options不能为null");
        }
        if (ranker == null) {
            throw new IllegalArgumentException("ranker不能为null");
        }
    }

    private Evaluation run(String query, SearchOptions options, Ranker ranker) {
        long startNanos = System.nanoTime();
        Map<String, Integer> multiplicities = new LinkedHashMap<>();
        for (String term : invertedIndex.getTerms(query == null ? "" : query)) {
            multiplicities.merge(term, 1, Integer::sum);
        }
        int distinctTerms = multiplicities.size();
        if (distinctTerms == 0) {
            logger.debug("查询不含任何词项: {}", query);
            return new Evaluation(List.of(), 0);
        }
        int requiredMatches = options.requiredMatches(distinctTerms);

        List<Cursor> cursors = new ArrayList<>(distinctTerms);
        for (Map.Entry<String, Integer> entry : multiplicities.entrySet()) {
            cursors.add(new Cursor(entry.getKey(), entry.getValue(),
                invertedIndex.getPostingsIterator(entry.getKey())));
        }

        Sieve sieve = new Sieve(options.hitCount());
        int candidates = 0;
        List<Cursor> matching = new ArrayList<>(distinctTerms);
        while (countActive(cursors) >= requiredMatches) {
            int documentId = smallestDocumentId(cursors);
            matching.clear();
            for (Cursor cursor : cursors) {
                if (cursor.current != null && cursor.current.documentId() == documentId) {
                    matching.add(cursor);
                }
            }
            if (matching.size() >= requiredMatches) {
                candidates++;
                ranker.reset(documentId);
                for (Cursor cursor : matching) {
                    ranker.update(cursor.term, cursor.multiplicity, cursor.current);
                }
                sieve.sift(ranker.evaluate(), documentId);
            }
            for (Cursor cursor : matching) {
                cursor.advance();
            }
        }

        List<SearchHit> hits = new ArrayList<>(sieve.size());
        for (Sieve.Winner winner : sieve.winners()) {
            hits.add(new SearchHit(winner.score(), corpus.getDocument(winner.documentId())));
        }
        if (logger.isDebugEnabled()) {
            long elapsedMicros = (System.nanoTime() - startNanos) / 1_000;
            logger.debug("查询完成: query=\"{}\", M={}, N={}, candidates={}, hits={}, elapsedMicros={}",
                query, distinctTerms, requiredMatches, candidates, hits.size(), elapsedMicros);
        }
        return new Evaluation(Collections.unmodifiableList(hits), candidates);
    }

    private int countActive(List<Cursor> cursors) {
        int active = 0;
        for (Cursor cursor : cursors) {
            if (cursor.current != null) {
                active++;
            }
        }
        return active;
    }

    private int smallestDocumentId(List<Cursor> cursors) {
        int smallest = Integer.MAX_VALUE;
        for (Cursor cursor : cursors) {
            if (cursor.current != null && cursor.current.documentId() < smallest) {
                smallest = cursor.current.documentId();
            }
        }
        return smallest;
    }

    /**
     * 单个查询词在其倒排列表上的游标。
     */
    private static final class Cursor {
        private final String term;
        private final int multiplicity;
        private final Iterator<Posting> postings;
        private Posting current;

        private Cursor(String term, int multiplicity, Iterator<Posting> postings) {
            this.term = term;
            this.multiplicity = multiplicity;
            this.postings = postings;
            advance();
        }

        private void advance() {
            current = postings.hasNext() ? postings.next() : null;
        }
    }

    private record Evaluation(List<SearchHit> hits, int candidates) {
    }

    /**
     * 第一次调用 hasNext/next 时才执行查询。
     */
    private static final class LazyHitIterator implements Iterator<SearchHit> {
        private final Supplier<List<SearchHit>> supplier;
        private Iterator<SearchHit> delegate;

        private LazyHitIterator(Supplier<List<SearchHit>> supplier) {
            this.supplier = supplier;
        }

        @Override
        public boolean hasNext() {
            if (delegate == null) {
                delegate = supplier.get().iterator();
            }
            return delegate.hasNext();
        }

        @Override
        public SearchHit next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return delegate.next();
        }
    }
}
