package com.corpussearch.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 SQLite 的语料库，字段以 JSON 文本保存。
 *
 * 文档ID按插入顺序从0开始稠密分配，不支持删除单篇文档。
 */
public final class DocumentTable implements Corpus, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DocumentTable.class);
    private static final TypeReference<Map<String, Object>> FIELDS_TYPE = new TypeReference<>() {
    };

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS documents (
                doc_id  INTEGER PRIMARY KEY,
                fields  TEXT NOT NULL
            )
            """;

    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";

    private final Connection connection;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * 打开或创建文档表并启用 WAL。
     */
    public DocumentTable(Path dbPath) {
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            initializeSchema();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化文档表失败: " + dbPath, sqlException);
        }
        logger.debug("文档表已打开: {}", dbPath);
    }

    /**
     * 插入文档并分配下一个文档ID。
     *
     * @param fields 文档字段
     * @return 新文档
     */
    public Document insert(Map<String, Object> fields) {
        Document document = new Document(size(), fields);
        String sql = "INSERT INTO documents(doc_id, fields) VALUES (?, ?)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, document.docId());
            preparedStatement.setString(2, writeFields(document.fields()));
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("插入文档失败, docId=" + document.docId(), sqlException);
        }
        return document;
    }

    /**
     * 批量导入另一个语料库的全部文档，单个事务内完成。
     *
     * @return 导入的文档数量
     */
    public int importFrom(Corpus source) {
        String sql = "INSERT INTO documents(doc_id, fields) VALUES (?, ?)";
        int nextDocId = size();
        int imported = 0;
        try {
            connection.setAutoCommit(false);
            try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
                for (Document document : source) {
                    preparedStatement.setInt(1, nextDocId + imported);
                    preparedStatement.setString(2, writeFields(document.fields()));
                    preparedStatement.addBatch();
                    imported++;
                }
                preparedStatement.executeBatch();
                connection.commit();
            } catch (SQLException | RuntimeException exception) {
                connection.rollback();
                throw exception;
            } finally {
                connection.setAutoCommit(true);
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("批量导入文档失败", sqlException);
        }
        logger.info("已导入 {} 篇文档", imported);
        return imported;
    }

    /**
     * 按 ID 查找文档。
     */
    public Optional<Document> findById(int docId) {
        String sql = "SELECT doc_id, fields FROM documents WHERE doc_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, docId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readDocument(resultSet));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按 ID 查询失败, docId=" + docId, sqlException);
        }
    }

    @Override
    public Document getDocument(int docId) {
        return findById(docId)
            .orElseThrow(() -> new IllegalArgumentException("文档不存在: docId=" + docId));
    }

    /**
     * 获取文档总数。
     */
    @Override
    public int size() {
        String sql = "SELECT COUNT(*) FROM documents";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.next() ? resultSet.getInt(1) : 0;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询文档总数失败", sqlException);
        }
    }

    /**
     * 一次性读出全部文档，按ID升序遍历。
     */
    @Override
    public Iterator<Document> iterator() {
        String sql = "SELECT doc_id, fields FROM documents ORDER BY doc_id";
        List<Document> documents = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                documents.add(readDocument(resultSet));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("遍历文档失败", sqlException);
        }
        return documents.iterator();
    }

    public void clear() {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM documents");
        } catch (SQLException sqlException) {
            throw new IllegalStateException("清空文档表失败", sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    /**
     * 读取当前连接的 journal_mode。
     */
    String getJournalMode() {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA journal_mode")) {
            return resultSet.next() ? resultSet.getString(1) : "";
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取 journal_mode 失败", sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
            statement.execute(CREATE_TABLE_SQL);
        }
    }

    private Document readDocument(ResultSet resultSet) throws SQLException {
        int docId = resultSet.getInt("doc_id");
        String json = resultSet.getString("fields");
        try {
            return new Document(docId, mapper.readValue(json, FIELDS_TYPE));
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("文档字段无法解析, docId=" + docId, exception);
        }
    }

    private String writeFields(Map<String, Object> fields) {
        try {
            return mapper.writeValueAsString(fields);
        } catch (JsonProcessingException exception) {
            throw new IllegalArgumentException("文档字段无法序列化: " + exception.getOriginalMessage(), exception);
        }
    }
}
