package com.corpussearch.query;

import com.corpussearch.document.Document;

public record SearchHit(
        double score,
        Document document
) {
}
