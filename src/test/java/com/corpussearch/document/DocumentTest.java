package com.corpussearch.document;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DocumentTest {

    @Test
    void testFieldAccess() {
        Document document = new Document(3, Map.of("body", "hello", "static_quality_score", 0.7));

        assertEquals("hello", document.getText("body"));
        assertEquals("", document.getText("title"));
        assertEquals(0.7, document.getField("static_quality_score", 0.0));
        assertEquals(0.0, document.getField("missing", 0.0));
        assertEquals("0.7", document.getText("static_quality_score"));
    }

    @Test
    void testFieldsAreCopiedAndImmutable() {
        Map<String, Object> fields = new HashMap<>();
        fields.put("body", "original");
        Document document = new Document(0, fields);

        fields.put("body", "changed");
        assertEquals("original", document.getText("body"));
        assertThrows(UnsupportedOperationException.class, () -> document.fields().put("x", "y"));
    }

    @Test
    void testNullFieldsAndInvalidId() {
        assertTrue(new Document(0, null).fields().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new Document(-1, Map.of()));
    }

    @Test
    void testInMemoryCorpusAssignsDenseIds() {
        InMemoryCorpus corpus = new InMemoryCorpus();
        corpus.addDocument(Map.of("body", "first"));
        Document second = corpus.addDocument(Map.of("body", "second"));

        assertEquals(1, second.docId());
        assertEquals(2, corpus.size());
        assertEquals("first", corpus.getDocument(0).getText("body"));
        assertThrows(IllegalArgumentException.class, () -> corpus.getDocument(2));
        assertThrows(IllegalArgumentException.class, () -> corpus.getDocument(-1));
    }
}
