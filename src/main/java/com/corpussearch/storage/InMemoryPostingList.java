package com.corpussearch.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * 未压缩的内存倒排列表。
 */
public final class InMemoryPostingList implements PostingList {
    private final List<Posting> postings;
    private final boolean frozen;

    public InMemoryPostingList() {
        this.postings = new ArrayList<>();
        this.frozen = false;
    }

    private InMemoryPostingList(List<Posting> postings) {
        this.postings = List.copyOf(postings);
        this.frozen = true;
    }

    @Override
    public void appendPosting(Posting posting) {
        if (posting == null) {
            throw new IllegalArgumentException("posting不能为null");
        }
        if (frozen) {
            throw new IllegalStateException("倒排列表已冻结，不能再追加");
        }
        if (!postings.isEmpty()) {
            int lastDocumentId = postings.get(postings.size() - 1).documentId();
            if (posting.documentId() <= lastDocumentId) {
                throw new IllegalArgumentException(
                    "documentId必须严格递增, last=" + lastDocumentId + ", current=" + posting.documentId());
            }
        }
        postings.add(posting);
    }

    @Override
    public int size() {
        return postings.size();
    }

    @Override
    public InMemoryPostingList freeze() {
        return frozen ? this : new InMemoryPostingList(postings);
    }

    @Override
    public Iterator<Posting> iterator() {
        return Collections.unmodifiableList(postings).iterator();
    }

    @Override
    public String toString() {
        return postings.toString();
    }
}
