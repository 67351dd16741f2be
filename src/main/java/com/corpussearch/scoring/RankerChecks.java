package com.corpussearch.scoring;

import com.corpussearch.storage.Posting;

final class RankerChecks {

    private RankerChecks() {
    }

    static void requireReset(int documentId) {
        if (documentId < 0) {
            throw new IllegalStateException("Ranker尚未reset");
        }
    }

    static void requireSameDocument(int documentId, Posting posting) {
        requireReset(documentId);
        if (posting == null || posting.documentId() != documentId) {
            throw new IllegalStateException("倒排项与当前文档不一致: expected=" + documentId
                + ", actual=" + (posting == null ? null : posting.documentId()));
        }
    }
}
