package com.nilsson.soeji.data;

import com.nilsson.soeji.model.TagRecord;
import com.nilsson.soeji.model.TagSource;
import com.nilsson.soeji.model.TagStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 <h2>TagRepository</h2>
 <p>
 Data access for the tag catalog and the per-image tag associations.
 </p>
 <ul>
 <li><b>Find-or-create:</b> tags are created lazily the first time any image uses a name. Two
 parallel ingestions may both miss the lookup and race to insert the same name; the loser sees
 a unique violation, re-reads and uses the winner's row. The loop is bounded by
 {@code maxAttempts}.</li>
 <li><b>Usage statistics:</b> association counts split into positive metadata, negative
 metadata and user-authored uses, the input of popularity evaluation.</li>
 <li><b>User associations:</b> idempotent insert and removal of {@code user}-sourced links.</li>
 </ul>
 */
public class TagRepository {

    private static final Logger logger = LoggerFactory.getLogger(TagRepository.class);

    private static final String STATS_SELECT = """
                SELECT t.id, t.name, t.category,
                       COALESCE(SUM(CASE WHEN it.source = 'user' THEN 0 WHEN it.is_negative = 0 THEN 1 ELSE 0 END), 0) AS meta_pos,
                       COALESCE(SUM(CASE WHEN it.source = 'user' THEN 0 WHEN it.is_negative = 1 THEN 1 ELSE 0 END), 0) AS meta_neg,
                       COALESCE(SUM(CASE WHEN it.source = 'user' THEN 1 ELSE 0 END), 0) AS user_count
                FROM tags t
                LEFT JOIN image_tags it ON it.tag_id = t.id
            """;

    private final DatabaseService db;
    private final int maxAttempts;

    public TagRepository(DatabaseService db, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.db = db;
        this.maxAttempts = maxAttempts;
    }

    // --- Lookup ---

    public Optional<TagRecord> findById(long id) throws SQLException {
        try (Connection conn = db.connect();
             PreparedStatement pstmt = conn.prepareStatement("SELECT id, name, category FROM tags WHERE id = ?")) {
            pstmt.setLong(1, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? Optional.of(mapTag(rs)) : Optional.empty();
            }
        }
    }

    public Optional<TagRecord> findByName(String name) throws SQLException {
        try (Connection conn = db.connect()) {
            return findByName(conn, name);
        }
    }

    protected Optional<TagRecord> findByName(Connection conn, String name) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT id, name, category FROM tags WHERE name = ?")) {
            pstmt.setString(1, name);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? Optional.of(mapTag(rs)) : Optional.empty();
            }
        }
    }

    // --- Find-or-create ---

    public TagRecord findOrCreate(String name) throws SQLException {
        try (Connection conn = db.connect()) {
            return findOrCreate(conn, name);
        }
    }

    /**
     Resolves a tag by name on the given connection, creating it when missing. The category is
     fixed by whichever caller creates the row first.

     @throws TagConflictException if every attempt hit a unique violation and the row still could
     not be read back
     */
    public TagRecord findOrCreate(Connection conn, String name) throws SQLException {
        SQLException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Optional<TagRecord> existing = findByName(conn, name);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                return insert(conn, name);
            } catch (SQLException e) {
                if (!SqlErrors.isUniqueViolation(e)) {
                    throw e;
                }
                lastConflict = e;
                logger.debug("Tag '{}' was created concurrently (attempt {}/{}), re-reading", name, attempt, maxAttempts);
            }
        }
        throw new TagConflictException(name, maxAttempts, lastConflict);
    }

    private TagRecord insert(Connection conn, String name) throws SQLException {
        String category = TagRecord.categoryOf(name);
        try (PreparedStatement pstmt = conn.prepareStatement(
                "INSERT INTO tags(name, category) VALUES(?, ?)", Statement.RETURN_GENERATED_KEYS)) {
            pstmt.setString(1, name);
            pstmt.setString(2, category);
            pstmt.executeUpdate();
            try (ResultSet rs = pstmt.getGeneratedKeys()) {
                if (rs.next()) {
                    return new TagRecord(rs.getLong(1), name, category);
                }
            }
        }
        throw new SQLException("Failed to read generated id for tag " + name);
    }

    // --- Associations ---

    /**
     Writes a metadata-sourced association. A second write for the same image and tag replaces
     weight, sign and source.
     */
    public void upsertImageTag(Connection conn, long imageId, long tagId, double weight,
                               boolean negative, TagSource source) throws SQLException {
        String sql = """
                    INSERT INTO image_tags(image_id, tag_id, weight, is_negative, source) VALUES(?, ?, ?, ?, ?)
                    ON CONFLICT(image_id, tag_id) DO UPDATE SET
                        weight = excluded.weight,
                        is_negative = excluded.is_negative,
                        source = excluded.source
                """;
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, imageId);
            pstmt.setLong(2, tagId);
            pstmt.setDouble(3, weight);
            pstmt.setBoolean(4, negative);
            pstmt.setString(5, source.wireName());
            pstmt.executeUpdate();
        }
    }

    /**
     Links a tag to an image as a user action. Returns false when the image already carries the
     tag, from any source.
     */
    public boolean addUserTag(long imageId, long tagId) throws SQLException {
        String sql = "INSERT OR IGNORE INTO image_tags(image_id, tag_id, weight, is_negative, source) VALUES(?, ?, 1.0, 0, ?)";
        try (Connection conn = db.connect(); PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, imageId);
            pstmt.setLong(2, tagId);
            pstmt.setString(3, TagSource.USER.wireName());
            return pstmt.executeUpdate() > 0;
        }
    }

    /**
     Removes a user-sourced link. Metadata-sourced links are never removed this way.
     */
    public boolean removeUserTag(long imageId, long tagId) throws SQLException {
        String sql = "DELETE FROM image_tags WHERE image_id = ? AND tag_id = ? AND source = ?";
        try (Connection conn = db.connect(); PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, imageId);
            pstmt.setLong(2, tagId);
            pstmt.setString(3, TagSource.USER.wireName());
            return pstmt.executeUpdate() > 0;
        }
    }

    public List<Long> findTagIdsForImage(long imageId) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (Connection conn = db.connect();
             PreparedStatement pstmt = conn.prepareStatement("SELECT tag_id FROM image_tags WHERE image_id = ?")) {
            pstmt.setLong(1, imageId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) ids.add(rs.getLong(1));
            }
        }
        return ids;
    }

    // --- Statistics ---

    public Optional<TagStats> getStats(long tagId) throws SQLException {
        try (Connection conn = db.connect();
             PreparedStatement pstmt = conn.prepareStatement(STATS_SELECT + " WHERE t.id = ? GROUP BY t.id")) {
            pstmt.setLong(1, tagId);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? Optional.of(mapStats(rs)) : Optional.empty();
            }
        }
    }

    /**
     Streams the statistics of every tag in the catalog, including tags no image uses anymore.
     */
    public void forEachTagStats(Consumer<TagStats> action) throws SQLException {
        try (Connection conn = db.connect();
             Statement stmt = conn.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
             ResultSet rs = stmt.executeQuery(STATS_SELECT + " GROUP BY t.id ORDER BY t.id")) {
            while (rs.next()) {
                action.accept(mapStats(rs));
            }
        }
    }

    public int countTags() throws SQLException {
        try (Connection conn = db.connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM tags")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    // --- Mapping ---

    private static TagRecord mapTag(ResultSet rs) throws SQLException {
        return new TagRecord(rs.getLong("id"), rs.getString("name"), rs.getString("category"));
    }

    private static TagStats mapStats(ResultSet rs) throws SQLException {
        return new TagStats(mapTag(rs), rs.getInt("meta_pos"), rs.getInt("meta_neg"), rs.getInt("user_count"));
    }
}
