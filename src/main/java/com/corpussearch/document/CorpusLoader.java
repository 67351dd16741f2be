package com.corpussearch.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 从文件加载语料库，支持 JSON 数组、JSON Lines 与带表头的 TSV。
 */
public final class CorpusLoader {
    private static final Logger logger = LoggerFactory.getLogger(CorpusLoader.class);
    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public CorpusLoader() {
        this(new ObjectMapper());
    }

    public CorpusLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * 按扩展名识别格式并加载语料库，文档ID按文件中的顺序分配。
     *
     * @param path 语料文件
     * @return 内存语料库
     * @throws IOException 文件不可读、格式不支持或内容非法
     */
    public InMemoryCorpus load(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IOException("语料文件不存在: " + path);
        }
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        long startNanos = System.nanoTime();
        InMemoryCorpus corpus = new InMemoryCorpus();
        if (fileName.endsWith(".json")) {
            loadJsonArray(path, corpus);
        } else if (fileName.endsWith(".jsonl") || fileName.endsWith(".ndjson")) {
            loadJsonLines(path, corpus);
        } else if (fileName.endsWith(".tsv")) {
            loadTsv(path, corpus);
        } else {
            throw new IOException("不支持的语料文件格式: " + path.getFileName());
        }
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.info("语料加载完成: file={}, documents={}, elapsedMs={}", path.getFileName(), corpus.size(), elapsedMs);
        return corpus;
    }

    private void loadJsonArray(Path path, InMemoryCorpus corpus) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(path.toFile());
        } catch (JsonProcessingException exception) {
            throw new IOException("JSON格式错误: " + path.getFileName() + " - " + exception.getOriginalMessage(), exception);
        }
        if (root == null || !root.isArray()) {
            throw new IOException("JSON语料必须是对象数组: " + path.getFileName());
        }
        int index = 0;
        for (JsonNode node : root) {
            corpus.addDocument(toFields(node, path, index));
            index++;
        }
    }

    private void loadJsonLines(Path path, InMemoryCorpus corpus) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        for (int lineNumber = 1; lineNumber <= lines.size(); lineNumber++) {
            String line = lines.get(lineNumber - 1);
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (JsonProcessingException exception) {
                throw new IOException("JSON格式错误: " + path.getFileName() + ", line=" + lineNumber
                    + " - " + exception.getOriginalMessage(), exception);
            }
            corpus.addDocument(toFields(node, path, lineNumber));
        }
    }

    private void loadTsv(Path path, InMemoryCorpus corpus) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null || headerLine.isBlank()) {
                throw new IOException("TSV语料缺少表头: " + path.getFileName());
            }
            String[] header = headerLine.split("\t", -1);
            String line;
            int lineNumber = 1;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String[] values = line.split("\t", -1);
                if (values.length > header.length) {
                    throw new IOException("TSV列数超过表头: " + path.getFileName() + ", line=" + lineNumber);
                }
                Map<String, Object> fields = new LinkedHashMap<>();
                for (int column = 0; column < values.length; column++) {
                    fields.put(header[column], values[column]);
                }
                corpus.addDocument(fields);
            }
        }
    }

    private Map<String, Object> toFields(JsonNode node, Path path, int position) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("语料条目必须是JSON对象: " + path.getFileName() + ", position=" + position);
        }
        return mapper.convertValue(node, FIELDS_TYPE);
    }
}
