package com.nilsson.soeji.data;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 Owns the SQLite connection pool of the authoritative store and brings the schema up to date
 using SQLite's {@code user_version}.
 <p>
 Write transactions are opened as {@code BEGIN IMMEDIATE} and wait on a busy timeout, so
 concurrent ingestions queue for the write lock instead of failing with {@code SQLITE_BUSY}.
 </p>
 */
public class DatabaseService {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);

    // --- Configuration ---
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";
    private static final int CURRENT_DB_VERSION = 2;
    private static final int BUSY_TIMEOUT_MILLIS = 10_000;
    private final HikariDataSource dataSource;

    // --- Lifecycle ---
    public DatabaseService(String jdbcUrl) {
        ensureParentDirectory(jdbcUrl);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setMaximumPoolSize(10);
        config.setMinimumIdle(2);
        config.setPoolName("SoejiPool");

        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("foreign_keys", "ON");
        config.addDataSourceProperty("synchronous", "NORMAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(BUSY_TIMEOUT_MILLIS));
        config.addDataSourceProperty("transaction_mode", "IMMEDIATE");

        this.dataSource = new HikariDataSource(config);
        performMigrations();
    }

    public void shutdown() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
        }
    }

    /**
     Creates the directory holding a file-backed SQLite database, if it does not exist yet.
     */
    public static void ensureParentDirectory(String jdbcUrl) {
        if (!jdbcUrl.startsWith(SQLITE_PREFIX)) return;
        String path = jdbcUrl.substring(SQLITE_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0) path = path.substring(0, query);
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file:")) return;

        File parent = new File(path).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) {
            parent.mkdirs();
        }
    }

    // --- Migration Engine ---
    private void performMigrations() {
        try (Connection conn = connect()) {
            conn.setAutoCommit(false);
            int currentVersion = getDatabaseVersion(conn);

            if (currentVersion < CURRENT_DB_VERSION) {
                logger.info("Migrating database from version {} to {}", currentVersion, CURRENT_DB_VERSION);
                try {
                    if (currentVersion < 1) applySchemaV1(conn);
                    if (currentVersion < 2) applySchemaV2(conn);

                    setDatabaseVersion(conn, CURRENT_DB_VERSION);
                    conn.commit();
                    logger.info("Database migration completed successfully.");
                } catch (SQLException e) {
                    conn.rollback();
                    throw e;
                }
            }
        } catch (SQLException e) {
            logger.error("CRITICAL: Failed to migrate database", e);
            throw new IllegalStateException("Database migration failed.", e);
        }
    }

    private int getDatabaseVersion(Connection conn) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA user_version;")) {
            if (rs.next()) {
                return rs.getInt(1);
            }
        }
        return 0;
    }

    private void setDatabaseVersion(Connection conn, int version) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute("PRAGMA user_version = " + version);
        }
    }

    // --- Schema Definitions ---
    private void applySchemaV1(Connection conn) throws SQLException {
        String createImagesTable = """
                    CREATE TABLE IF NOT EXISTS images (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        filename TEXT NOT NULL,
                        storage_key TEXT UNIQUE NOT NULL,
                        file_hash TEXT UNIQUE NOT NULL,
                        width INTEGER,
                        height INTEGER,
                        has_lossless_derivative INTEGER NOT NULL DEFAULT 0,
                        has_metadata_file INTEGER NOT NULL DEFAULT 0,
                        created_at INTEGER NOT NULL
                    );
                """;

        String createMetadataTable = """
                    CREATE TABLE IF NOT EXISTS image_metadata (
                        image_id INTEGER PRIMARY KEY,
                        prompt TEXT,
                        negative_prompt TEXT,
                        seed INTEGER,
                        steps INTEGER,
                        scale REAL,
                        sampler TEXT,
                        width INTEGER,
                        height INTEGER,
                        raw_comment TEXT NOT NULL DEFAULT '',
                        FOREIGN KEY(image_id) REFERENCES images(id) ON DELETE CASCADE
                    );
                """;

        String createTagsTable = """
                    CREATE TABLE IF NOT EXISTS tags (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT UNIQUE NOT NULL,
                        category TEXT
                    );
                """;

        String createImageTagsTable = """
                    CREATE TABLE IF NOT EXISTS image_tags (
                        image_id INTEGER NOT NULL,
                        tag_id INTEGER NOT NULL,
                        weight REAL NOT NULL DEFAULT 1.0,
                        is_negative INTEGER NOT NULL DEFAULT 0,
                        source TEXT,
                        PRIMARY KEY (image_id, tag_id),
                        FOREIGN KEY(image_id) REFERENCES images(id) ON DELETE CASCADE,
                        FOREIGN KEY(tag_id) REFERENCES tags(id)
                    );
                """;

        try (Statement stmt = conn.createStatement()) {
            stmt.execute(createImagesTable);
            stmt.execute(createMetadataTable);
            stmt.execute(createTagsTable);
            stmt.execute(createImageTagsTable);

            stmt.execute("CREATE INDEX IF NOT EXISTS idx_image_tags_tag ON image_tags(tag_id);");
        }
    }

    private void applySchemaV2(Connection conn) throws SQLException {
        logger.info("Applying Schema V2: v4 structured captions...");
        try (Statement stmt = conn.createStatement()) {
            boolean hasCaptionCol = false;
            try (ResultSet rs = conn.getMetaData().getColumns(null, null, "image_metadata", "v4_base_caption")) {
                if (rs.next()) hasCaptionCol = true;
            }
            if (!hasCaptionCol) {
                stmt.execute("ALTER TABLE image_metadata ADD COLUMN v4_base_caption TEXT;");
                stmt.execute("ALTER TABLE image_metadata ADD COLUMN v4_char_captions TEXT;");
            }
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_images_missing_derivatives "
                    + "ON images(has_lossless_derivative, has_metadata_file);");
        }
    }

    // --- Connection Management ---
    public Connection connect() throws SQLException {
        return dataSource.getConnection();
    }
}
