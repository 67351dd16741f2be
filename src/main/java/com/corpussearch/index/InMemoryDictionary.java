package com.corpussearch.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 内存词典，遍历顺序即插入顺序。
 */
public final class InMemoryDictionary implements Dictionary {
    private final Map<String, Integer> termIds = new HashMap<>();
    private final List<String> terms = new ArrayList<>();

    @Override
    public int addIfAbsent(String term) {
        if (term == null) {
            throw new IllegalArgumentException("term不能为null");
        }
        Integer existing = termIds.get(term);
        if (existing != null) {
            return existing;
        }
        int termId = terms.size();
        termIds.put(term, termId);
        terms.add(term);
        return termId;
    }

    @Override
    public OptionalInt getTermId(String term) {
        Integer termId = term == null ? null : termIds.get(term);
        return termId == null ? OptionalInt.empty() : OptionalInt.of(termId);
    }

    @Override
    public String getTerm(int termId) {
        if (termId < 0 || termId >= terms.size()) {
            throw new IllegalArgumentException("termId越界: " + termId + ", size=" + terms.size());
        }
        return terms.get(termId);
    }

    @Override
    public int size() {
        return terms.size();
    }

    @Override
    public Iterator<String> iterator() {
        return Collections.unmodifiableList(terms).iterator();
    }
}
