package com.corpussearch.integration;

import com.corpussearch.config.EngineConfig;
import com.corpussearch.document.CorpusLoader;
import com.corpussearch.document.DocumentTable;
import com.corpussearch.document.InMemoryCorpus;
import com.corpussearch.index.InMemoryInvertedIndex;
import com.corpussearch.query.SearchOptions;
import com.corpussearch.query.SearchResult;
import com.corpussearch.query.SimpleSearchEngine;
import com.corpussearch.scoring.TfIdfRanker;
import com.corpussearch.text.SimpleNormalizer;
import com.corpussearch.text.SimpleTokenizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchIntegrationTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("文件加载 -> SQLite 文档表 -> 压缩/非压缩索引结果一致")
    void testEndToEndWithDocumentTable() throws IOException {
        Path corpusFile = tempDir.resolve("wiki.jsonl");
        Files.writeString(corpusFile, String.join("\n",
            "{\"title\": \"Oslo\", \"body\": \"Oslo is the capital of Norway\", \"static_quality_score\": 0.9}",
            "{\"title\": \"Bergen\", \"body\": \"Bergen is a city in Norway\", \"static_quality_score\": 0.4}",
            "{\"title\": \"Stockholm\", \"body\": \"Stockholm is the capital of Sweden\", \"static_quality_score\": 0.7}",
            "{\"title\": \"Fjord\", \"body\": \"A fjord is a long narrow inlet\", \"static_quality_score\": \"0.2\"}",
            ""));

        InMemoryCorpus loaded = new CorpusLoader().load(corpusFile);
        EngineConfig config = EngineConfig.defaults();
        config.setFields(List.of("title", "body"));

        try (DocumentTable documentTable = new DocumentTable(tempDir.resolve("wiki.db"))) {
            assertEquals(4, documentTable.importFrom(loaded));

            SearchOptions options = new SearchOptions(0.5, 3);
            String query = "capital of norway";

            SearchResult plain = search(documentTable, config, false, query, options);
            SearchResult compressed = search(documentTable, config, true, query, options);

            assertEquals(docIds(plain), docIds(compressed));
            assertEquals(2, plain.totalMatches());
            assertEquals(List.of(0, 2), docIds(plain));
            assertEquals(0, plain.hits().get(0).document().docId());
            assertEquals("Oslo", plain.hits().get(0).document().getText("title"));
            for (int i = 0; i < plain.hits().size(); i++) {
                assertEquals(plain.hits().get(i).score(), compressed.hits().get(i).score(), 1e-12);
            }
            for (int i = 1; i < plain.hits().size(); i++) {
                assertTrue(plain.hits().get(i - 1).score() >= plain.hits().get(i).score());
            }
        }
    }

    private SearchResult search(DocumentTable corpus, EngineConfig config, boolean compressed,
                                String query, SearchOptions options) {
        InMemoryInvertedIndex index = new InMemoryInvertedIndex(
            corpus, config.getFields(), new SimpleNormalizer(), new SimpleTokenizer(), compressed);
        SimpleSearchEngine engine = new SimpleSearchEngine(corpus, index);
        return engine.search(query, options, new TfIdfRanker(corpus, index, config));
    }

    private List<Integer> docIds(SearchResult result) {
        return result.hits().stream().map(hit -> hit.document().docId()).toList();
    }
}
