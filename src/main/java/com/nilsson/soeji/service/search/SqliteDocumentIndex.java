package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nilsson.soeji.data.DatabaseService;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 <h2>SqliteDocumentIndex</h2>
 <p>
 {@link DocumentIndex} kept in a dedicated SQLite database. Document bodies are stored as JSON
 rows keyed by collection and id. The text of every searchable attribute is copied into an FTS5
 table, one row per document and attribute, which answers word-prefix lookups.
 </p>
 <p>
 A search is one SQL statement: the FTS5 matches are scored per document, filters become
 {@code json_each} predicates over the stored body, and sorting and paging run in SQLite.
 Filtering or sorting on an attribute that the collection does not declare filterable or
 sortable is rejected, as a search engine would.
 </p>
 */
public class SqliteDocumentIndex implements DocumentIndex {

    private static final Logger logger = LoggerFactory.getLogger(SqliteDocumentIndex.class);
    private static final Pattern WORD = Pattern.compile("[\\p{L}\\p{N}]+");
    private static final String ID_FIELD = "id";
    private static final int CURRENT_SCHEMA_VERSION = 1;

    private final HikariDataSource dataSource;
    private final ObjectMapper mapper;
    private final Map<String, IndexSettings> settingsCache = new ConcurrentHashMap<>();

    public SqliteDocumentIndex(String jdbcUrl, ObjectMapper mapper) {
        this.mapper = mapper;
        DatabaseService.ensureParentDirectory(jdbcUrl);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setMaximumPoolSize(6);
        config.setMinimumIdle(1);
        config.setPoolName("SoejiSearchPool");
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", "10000");
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");

        this.dataSource = new HikariDataSource(config);
        createSchema();
    }

    public void shutdown() {
        if (!dataSource.isClosed()) {
            dataSource.close();
        }
    }

    private void createSchema() {
        inTransaction("create index schema", conn -> {
            try (Statement stmt = conn.createStatement()) {
                int version = 0;
                try (ResultSet rs = stmt.executeQuery("PRAGMA user_version;")) {
                    if (rs.next()) version = rs.getInt(1);
                }
                if (version >= CURRENT_SCHEMA_VERSION) return;

                stmt.execute("""
                            CREATE TABLE IF NOT EXISTS index_collections (
                                name TEXT PRIMARY KEY,
                                settings TEXT NOT NULL
                            );
                        """);
                stmt.execute("""
                            CREATE TABLE IF NOT EXISTS index_documents (
                                collection TEXT NOT NULL,
                                doc_id TEXT NOT NULL,
                                body TEXT NOT NULL,
                                PRIMARY KEY (collection, doc_id)
                            );
                        """);
                stmt.execute("CREATE VIRTUAL TABLE IF NOT EXISTS index_terms USING fts5("
                        + "collection UNINDEXED, doc_id UNINDEXED, field UNINDEXED, content, tokenize = 'unicode61');");
                stmt.execute("PRAGMA user_version = " + CURRENT_SCHEMA_VERSION);
            }
        });
    }

    // --- Settings ---

    @Override
    public void configure(String collection, IndexSettings settings) {
        inTransaction("configure " + collection, conn -> {
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "INSERT INTO index_collections(name, settings) VALUES(?, ?) "
                            + "ON CONFLICT(name) DO UPDATE SET settings = excluded.settings")) {
                pstmt.setString(1, collection);
                pstmt.setString(2, writeJson(settings));
                pstmt.executeUpdate();
            }
            rebuildTerms(conn, collection, settings);
        });
        settingsCache.put(collection, settings);
        logger.debug("Configured collection {}", collection);
    }

    @Override
    public IndexSettings getSettings(String collection) {
        IndexSettings cached = settingsCache.get(collection);
        if (cached != null) return cached;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement("SELECT settings FROM index_collections WHERE name = ?")) {
            pstmt.setString(1, collection);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (!rs.next()) return IndexSettings.defaults();
                IndexSettings settings = mapper.readValue(rs.getString(1), IndexSettings.class);
                settingsCache.put(collection, settings);
                return settings;
            }
        } catch (SQLException | JsonProcessingException e) {
            throw new IndexException("Failed to read settings of " + collection, e);
        }
    }

    private void rebuildTerms(Connection conn, String collection, IndexSettings settings) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("DELETE FROM index_terms WHERE collection = ?")) {
            pstmt.setString(1, collection);
            pstmt.executeUpdate();
        }
        for (Map.Entry<String, ObjectNode> entry : loadDocuments(conn, collection).entrySet()) {
            insertTerms(conn, collection, entry.getKey(), entry.getValue(), settings);
        }
    }

    // --- Writes ---

    @Override
    public void addDocuments(String collection, List<ObjectNode> documents) {
        if (documents.isEmpty()) return;
        IndexSettings settings = getSettings(collection);
        inTransaction("add documents to " + collection, conn -> {
            for (ObjectNode document : documents) {
                writeDocument(conn, collection, idOf(document), document, settings);
            }
        });
    }

    @Override
    public void updateDocuments(String collection, List<ObjectNode> documents) {
        if (documents.isEmpty()) return;
        IndexSettings settings = getSettings(collection);
        inTransaction("update documents in " + collection, conn -> {
            for (ObjectNode partial : documents) {
                String id = idOf(partial);
                ObjectNode merged = loadDocument(conn, collection, id).orElseGet(mapper::createObjectNode);
                merged.setAll(partial);
                writeDocument(conn, collection, id, merged, settings);
            }
        });
    }

    @Override
    public boolean deleteDocument(String collection, String id) {
        boolean[] deleted = {false};
        inTransaction("delete document " + id + " from " + collection, conn -> {
            deleteTerms(conn, collection, id);
            try (PreparedStatement pstmt = conn.prepareStatement(
                    "DELETE FROM index_documents WHERE collection = ? AND doc_id = ?")) {
                pstmt.setString(1, collection);
                pstmt.setString(2, id);
                deleted[0] = pstmt.executeUpdate() > 0;
            }
        });
        return deleted[0];
    }

    @Override
    public void deleteAllDocuments(String collection) {
        inTransaction("clear " + collection, conn -> {
            try (PreparedStatement terms = conn.prepareStatement("DELETE FROM index_terms WHERE collection = ?");
                 PreparedStatement docs = conn.prepareStatement("DELETE FROM index_documents WHERE collection = ?")) {
                terms.setString(1, collection);
                terms.executeUpdate();
                docs.setString(1, collection);
                docs.executeUpdate();
            }
        });
    }

    private void writeDocument(Connection conn, String collection, String id, ObjectNode document,
                               IndexSettings settings) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(
                "INSERT INTO index_documents(collection, doc_id, body) VALUES(?, ?, ?) "
                        + "ON CONFLICT(collection, doc_id) DO UPDATE SET body = excluded.body")) {
            pstmt.setString(1, collection);
            pstmt.setString(2, id);
            pstmt.setString(3, writeJson(document));
            pstmt.executeUpdate();
        }
        deleteTerms(conn, collection, id);
        insertTerms(conn, collection, id, document, settings);
    }

    private void insertTerms(Connection conn, String collection, String id, ObjectNode document,
                             IndexSettings settings) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(
                "INSERT INTO index_terms(collection, doc_id, field, content) VALUES(?, ?, ?, ?)")) {
            Iterator<Map.Entry<String, JsonNode>> fields = document.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (ID_FIELD.equals(field.getKey()) || !settings.isSearchable(field.getKey())) continue;

                String text = textOf(field.getValue());
                if (text.isBlank()) continue;
                pstmt.setString(1, collection);
                pstmt.setString(2, id);
                pstmt.setString(3, field.getKey());
                pstmt.setString(4, text);
                pstmt.addBatch();
            }
            pstmt.executeBatch();
        }
    }

    private void deleteTerms(Connection conn, String collection, String id) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(
                "DELETE FROM index_terms WHERE collection = ? AND doc_id = ?")) {
            pstmt.setString(1, collection);
            pstmt.setString(2, id);
            pstmt.executeUpdate();
        }
    }

    // --- Reads ---

    @Override
    public Optional<ObjectNode> getDocument(String collection, String id) {
        try (Connection conn = dataSource.getConnection()) {
            return loadDocument(conn, collection, id);
        } catch (SQLException e) {
            throw new IndexException("Failed to read document " + id + " from " + collection, e);
        }
    }

    @Override
    public long countDocuments(String collection) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement pstmt = conn.prepareStatement("SELECT COUNT(*) FROM index_documents WHERE collection = ?")) {
            pstmt.setString(1, collection);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            throw new IndexException("Failed to count documents of " + collection, e);
        }
    }

    @Override
    public SearchResult search(String collection, SearchQuery query) {
        IndexSettings settings = getSettings(collection);
        validate(collection, query, settings);

        List<String> words = words(query.getText());
        List<String> fields = query.getSearchableFields();
        if (!words.isEmpty() && fields != null && fields.isEmpty()) {
            return new SearchResult(List.of(), 0, query.getLimit(), query.getOffset());
        }

        SqlQuery from = matchingDocuments(collection, query, words);

        SqlQuery count = new SqlQuery().append("SELECT COUNT(*) ").append(from);

        SqlQuery page = new SqlQuery().append("SELECT d.body ").append(from).append("ORDER BY ");
        for (SearchQuery.Sort sort : query.getSort()) {
            String path = jsonPath(sort.getField());
            page.append("(json_extract(d.body, ?) IS NULL), ", path)
                    .append("json_extract(d.body, ?) " + (sort.isDescending() ? "DESC" : "ASC") + ", ", path);
        }
        if (!words.isEmpty()) page.append("s.score DESC, ");
        page.append("d.rowid LIMIT ? OFFSET ?", query.getLimit(), query.getOffset());

        try (Connection conn = dataSource.getConnection()) {
            long total;
            try (PreparedStatement pstmt = count.prepare(conn);
                 ResultSet rs = pstmt.executeQuery()) {
                total = rs.next() ? rs.getLong(1) : 0;
            }
            List<ObjectNode> hits = new ArrayList<>();
            try (PreparedStatement pstmt = page.prepare(conn);
                 ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) hits.add(readDocument(rs.getString(1)));
            }
            return new SearchResult(hits, total, query.getLimit(), query.getOffset());
        } catch (SQLException e) {
            throw new IndexException("Search in " + collection + " failed", e);
        }
    }

    /**
     The {@code FROM ... WHERE} part shared by the count and the page query. With words, every
     document is scored by how many distinct words matched one of its searchable attributes.
     */
    private static SqlQuery matchingDocuments(String collection, SearchQuery query, List<String> words) {
        SqlQuery sql = new SqlQuery();
        if (words.isEmpty()) {
            sql.append("FROM index_documents d WHERE d.collection = ? ", collection);
        } else {
            sql.append("FROM index_documents d JOIN (SELECT doc_id, COUNT(DISTINCT word) AS score FROM (");
            for (int i = 0; i < words.size(); i++) {
                if (i > 0) sql.append(" UNION ALL ");
                sql.append("SELECT doc_id, " + i + " AS word FROM index_terms WHERE index_terms MATCH ? AND collection = ?",
                        "\"" + words.get(i) + "\"*", collection);
                List<String> fields = query.getSearchableFields();
                if (fields != null) {
                    sql.append(" AND field IN (" + fields.stream().map(f -> "?").collect(Collectors.joining(",")) + ")",
                            fields.toArray());
                }
            }
            int required = query.getMatchingStrategy() == SearchQuery.MatchingStrategy.ALL ? words.size() : 1;
            sql.append(") GROUP BY doc_id) s ON s.doc_id = d.doc_id WHERE d.collection = ? AND s.score >= ? ",
                    collection, required);
        }

        for (SearchQuery.Filter filter : query.getFilters()) {
            String expected = String.valueOf(filter.getValue());
            sql.append("AND EXISTS (SELECT 1 FROM json_each(d.body, ?) e WHERE "
                            + "(e.type = 'text' AND e.value = ?) "
                            + "OR (e.type IN ('integer', 'real') AND e.value = ?) "
                            + "OR (e.type IN ('true', 'false') AND e.type = ?)) ",
                    jsonPath(filter.getField()), expected, numericValue(expected), expected);
        }
        return sql;
    }

    private static void validate(String collection, SearchQuery query, IndexSettings settings) {
        for (SearchQuery.Filter filter : query.getFilters()) {
            if (!settings.isFilterable(filter.getField())) {
                throw new IndexException("Attribute '" + filter.getField() + "' is not filterable in " + collection);
            }
        }
        for (SearchQuery.Sort sort : query.getSort()) {
            if (!settings.isSortable(sort.getField())) {
                throw new IndexException("Attribute '" + sort.getField() + "' is not sortable in " + collection);
            }
        }
        if (query.getSearchableFields() != null) {
            for (String field : query.getSearchableFields()) {
                if (!settings.isSearchable(field)) {
                    throw new IndexException("Attribute '" + field + "' is not searchable in " + collection);
                }
            }
        }
    }

    private Optional<ObjectNode> loadDocument(Connection conn, String collection, String id) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement(
                "SELECT body FROM index_documents WHERE collection = ? AND doc_id = ?")) {
            pstmt.setString(1, collection);
            pstmt.setString(2, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? Optional.of(readDocument(rs.getString(1))) : Optional.empty();
            }
        }
    }

    /**
     All documents of a collection in insertion order, keyed by id.
     */
    private Map<String, ObjectNode> loadDocuments(Connection conn, String collection) throws SQLException {
        Map<String, ObjectNode> documents = new LinkedHashMap<>();
        try (PreparedStatement pstmt = conn.prepareStatement(
                "SELECT doc_id, body FROM index_documents WHERE collection = ? ORDER BY rowid")) {
            pstmt.setString(1, collection);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    documents.put(rs.getString(1), readDocument(rs.getString(2)));
                }
            }
        }
        return documents;
    }

    // --- Evaluation ---

    static List<String> words(String text) {
        Set<String> words = new LinkedHashSet<>();
        if (text != null) {
            Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
            while (m.find()) words.add(m.group());
        }
        return new ArrayList<>(words);
    }

    static String jsonPath(String field) {
        return "$.\"" + field.replace("\"", "") + "\"";
    }

    /**
     The filter value as an SQL number, or {@code null} when it is not numeric so that it only
     matches text and boolean attributes.
     */
    static Object numericValue(String expected) {
        BigDecimal number;
        try {
            number = new BigDecimal(expected.trim());
        } catch (NumberFormatException e) {
            return null;
        }
        if (number.stripTrailingZeros().scale() <= 0) {
            try {
                return number.longValueExact();
            } catch (ArithmeticException e) {
                return number.doubleValue();
            }
        }
        return number.doubleValue();
    }

    private static String textOf(JsonNode node) {
        if (node == null || node.isNull()) return "";
        if (node.isValueNode()) return node.asText();
        List<String> parts = new ArrayList<>();
        for (JsonNode child : node) {
            String text = textOf(child);
            if (!text.isEmpty()) parts.add(text);
        }
        return String.join(" ", parts);
    }

    // --- Plumbing ---

    private static String idOf(ObjectNode document) {
        JsonNode id = document.get(ID_FIELD);
        if (id == null || !id.isValueNode() || id.isNull() || id.asText().isEmpty()) {
            throw new IndexException("Document has no id: " + document);
        }
        return id.asText();
    }

    private String writeJson(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IndexException("Failed to serialize document", e);
        }
    }

    private ObjectNode readDocument(String json) {
        try {
            return (ObjectNode) mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IndexException("Stored document is not valid JSON", e);
        }
    }

    /**
     SQL text assembled together with its positional parameters.
     */
    private static final class SqlQuery {
        private final StringBuilder sql = new StringBuilder();
        private final List<Object> params = new ArrayList<>();

        SqlQuery append(String fragment, Object... values) {
            sql.append(fragment);
            params.addAll(Arrays.asList(values));
            return this;
        }

        SqlQuery append(SqlQuery other) {
            sql.append(other.sql);
            params.addAll(other.params);
            return this;
        }

        PreparedStatement prepare(Connection conn) throws SQLException {
            PreparedStatement pstmt = conn.prepareStatement(sql.toString());
            try {
                for (int k = 0; k < params.size(); k++) {
                    pstmt.setObject(k + 1, params.get(k));
                }
            } catch (SQLException e) {
                pstmt.close();
                throw e;
            }
            return pstmt;
        }
    }

    @FunctionalInterface
    private interface SqlWork {
        void run(Connection conn) throws SQLException;
    }

    private void inTransaction(String action, SqlWork work) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                work.run(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IndexException("Failed to " + action, e);
        }
    }
}
