package com.nilsson.soeji.data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nilsson.soeji.model.CharCaption;
import com.nilsson.soeji.model.GenerationMetadata;
import com.nilsson.soeji.model.ImageRecord;
import com.nilsson.soeji.model.ImageTagRecord;
import com.nilsson.soeji.model.NewImage;
import com.nilsson.soeji.model.TagRecord;
import com.nilsson.soeji.model.TagSource;
import com.nilsson.soeji.model.WeightedTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.inject.Inject;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 <h2>ImageRepository</h2>
 <p>
 Data Access Object for image entities, their generation metadata and their tag associations.
 </p>
 <ul>
 <li><b>Identity:</b> one row per unique content hash. {@link #create} is the only way a row
 is born, and a concurrent insert of the same hash is reported as "already exists" instead of
 an error.</li>
 <li><b>Structured record:</b> the image row, its metadata row and every metadata tag
 association are written in a single transaction.</li>
 <li><b>Derivative flags:</b> the only columns that change after creation.</li>
 <li><b>Repair scans:</b> id listings used by the batch reindex tool.</li>
 </ul>
 */
public class ImageRepository {

    private static final Logger logger = LoggerFactory.getLogger(ImageRepository.class);
    private static final TypeReference<List<CharCaption>> CHAR_CAPTIONS = new TypeReference<>() {
    };

    private final DatabaseService db;
    private final TagRepository tagRepository;
    private final ObjectMapper mapper;

    @Inject
    public ImageRepository(DatabaseService db, TagRepository tagRepository, ObjectMapper mapper) {
        this.db = db;
        this.tagRepository = tagRepository;
        this.mapper = mapper;
    }

    // --- Core Identity ---

    /**
     Looks up an image by content hash. The returned record carries no metadata or tags.
     */
    public Optional<ImageRecord> findByHash(String hash) throws SQLException {
        try (Connection conn = db.connect();
             PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM images WHERE file_hash = ?")) {
            pstmt.setString(1, hash);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? Optional.of(mapImage(rs, null, List.of())) : Optional.empty();
            }
        }
    }

    /**
     Loads an image with its metadata row and tag associations.
     */
    public Optional<ImageRecord> findById(long id) throws SQLException {
        try (Connection conn = db.connect()) {
            return findById(conn, id);
        }
    }

    private Optional<ImageRecord> findById(Connection conn, long id) throws SQLException {
        List<ImageTagRecord> tags = loadTags(conn, id);
        GenerationMetadata metadata = loadMetadata(conn, id, tags);
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM images WHERE id = ?")) {
            pstmt.setLong(1, id);
            try (ResultSet rs = pstmt.executeQuery()) {
                return rs.next() ? Optional.of(mapImage(rs, metadata, tags)) : Optional.empty();
            }
        }
    }

    // --- Creation ---

    /**
     Persists a new image with its metadata and metadata-sourced tag associations in one
     transaction.

     @return the stored record, or empty if another writer stored the same content hash first
     */
    public Optional<ImageRecord> create(NewImage image, GenerationMetadata metadata) throws SQLException {
        try (Connection conn = db.connect()) {
            conn.setAutoCommit(false);
            try {
                long imageId;
                try {
                    imageId = insertImage(conn, image);
                } catch (SQLException e) {
                    if (!SqlErrors.isUniqueViolation(e)) throw e;
                    conn.rollback();
                    logger.debug("Image {} was stored concurrently", image.fileHash);
                    return Optional.empty();
                }

                insertMetadata(conn, imageId, metadata);
                for (WeightedTag tag : metadata.getTags()) {
                    TagRecord record = tagRepository.findOrCreate(conn, tag.getName());
                    tagRepository.upsertImageTag(conn, imageId, record.id, tag.getWeight(), tag.isNegative(), tag.getSource());
                }

                Optional<ImageRecord> created = findById(conn, imageId);
                conn.commit();
                return created;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private long insertImage(Connection conn, NewImage image) throws SQLException {
        String sql = """
                    INSERT INTO images(filename, storage_key, file_hash, width, height,
                                       has_lossless_derivative, has_metadata_file, created_at)
                    VALUES(?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement pstmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            pstmt.setString(1, image.filename);
            pstmt.setString(2, image.storageKey);
            pstmt.setString(3, image.fileHash);
            setNullableInt(pstmt, 4, image.width);
            setNullableInt(pstmt, 5, image.height);
            pstmt.setBoolean(6, image.hasLosslessDerivative);
            pstmt.setBoolean(7, image.hasMetadataFile);
            pstmt.setLong(8, image.createdAt.toEpochMilli());
            pstmt.executeUpdate();
            try (ResultSet rs = pstmt.getGeneratedKeys()) {
                if (rs.next()) return rs.getLong(1);
            }
        }
        throw new SQLException("Failed to read generated id for image " + image.fileHash);
    }

    private void insertMetadata(Connection conn, long imageId, GenerationMetadata metadata) throws SQLException {
        String sql = """
                    INSERT INTO image_metadata(image_id, prompt, negative_prompt, seed, steps, scale, sampler,
                                               width, height, raw_comment, v4_base_caption, v4_char_captions)
                    VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, imageId);
            pstmt.setString(2, metadata.getPrompt());
            pstmt.setString(3, metadata.getNegativePrompt());
            if (metadata.getSeed() != null) pstmt.setLong(4, metadata.getSeed());
            else pstmt.setNull(4, Types.BIGINT);
            setNullableInt(pstmt, 5, metadata.getSteps());
            if (metadata.getScale() != null) pstmt.setDouble(6, metadata.getScale());
            else pstmt.setNull(6, Types.REAL);
            pstmt.setString(7, metadata.getSampler());
            setNullableInt(pstmt, 8, metadata.getWidth());
            setNullableInt(pstmt, 9, metadata.getHeight());
            pstmt.setString(10, metadata.getRawComment());
            pstmt.setString(11, metadata.getV4BaseCaption());
            pstmt.setString(12, encodeCharCaptions(metadata.getV4CharCaptions()));
            pstmt.executeUpdate();
        }
    }

    // --- Derivative flags ---

    public void markLosslessDerivative(long imageId) throws SQLException {
        updateFlag("has_lossless_derivative", imageId);
    }

    public void markMetadataFile(long imageId) throws SQLException {
        updateFlag("has_metadata_file", imageId);
    }

    private void updateFlag(String column, long imageId) throws SQLException {
        try (Connection conn = db.connect();
             PreparedStatement pstmt = conn.prepareStatement("UPDATE images SET " + column + " = 1 WHERE id = ?")) {
            pstmt.setLong(1, imageId);
            pstmt.executeUpdate();
        }
    }

    // --- Repair scans ---

    public List<Long> findIdsWithoutLosslessDerivative() throws SQLException {
        return findIds("SELECT id FROM images WHERE has_lossless_derivative = 0 ORDER BY id");
    }

    public List<Long> findIdsWithoutMetadataFile() throws SQLException {
        return findIds("SELECT id FROM images WHERE has_metadata_file = 0 ORDER BY id");
    }

    public List<Long> findAllIds() throws SQLException {
        return findIds("SELECT id FROM images ORDER BY id");
    }

    private List<Long> findIds(String sql) throws SQLException {
        List<Long> ids = new ArrayList<>();
        try (Connection conn = db.connect();
             Statement stmt = conn.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY);
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) ids.add(rs.getLong(1));
        }
        return ids;
    }

    public int countImages() throws SQLException {
        try (Connection conn = db.connect();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM images")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    // --- Deletion ---

    /**
     Deletes the image row. Metadata and tag associations go with it; tags themselves stay.
     */
    public boolean delete(long imageId) throws SQLException {
        try (Connection conn = db.connect();
             PreparedStatement pstmt = conn.prepareStatement("DELETE FROM images WHERE id = ?")) {
            pstmt.setLong(1, imageId);
            return pstmt.executeUpdate() > 0;
        }
    }

    // --- Mapping ---

    private List<ImageTagRecord> loadTags(Connection conn, long imageId) throws SQLException {
        String sql = """
                    SELECT it.tag_id, t.name, t.category, it.weight, it.is_negative, it.source
                    FROM image_tags it
                    JOIN tags t ON t.id = it.tag_id
                    WHERE it.image_id = ?
                    ORDER BY it.rowid
                """;
        List<ImageTagRecord> tags = new ArrayList<>();
        try (PreparedStatement pstmt = conn.prepareStatement(sql)) {
            pstmt.setLong(1, imageId);
            try (ResultSet rs = pstmt.executeQuery()) {
                while (rs.next()) {
                    tags.add(new ImageTagRecord(
                            rs.getLong("tag_id"),
                            rs.getString("name"),
                            rs.getString("category"),
                            rs.getDouble("weight"),
                            rs.getBoolean("is_negative"),
                            TagSource.fromWire(rs.getString("source"))));
                }
            }
        }
        return tags;
    }

    private GenerationMetadata loadMetadata(Connection conn, long imageId, List<ImageTagRecord> tags) throws SQLException {
        try (PreparedStatement pstmt = conn.prepareStatement("SELECT * FROM image_metadata WHERE image_id = ?")) {
            pstmt.setLong(1, imageId);
            try (ResultSet rs = pstmt.executeQuery()) {
                if (!rs.next()) return null;

                GenerationMetadata metadata = GenerationMetadata.empty(rs.getString("raw_comment"));
                metadata.setPrompt(rs.getString("prompt"));
                metadata.setNegativePrompt(rs.getString("negative_prompt"));
                metadata.setSeed(getNullableLong(rs, "seed"));
                metadata.setSteps(getNullableInt(rs, "steps"));
                double scale = rs.getDouble("scale");
                metadata.setScale(rs.wasNull() ? null : scale);
                metadata.setSampler(rs.getString("sampler"));
                metadata.setWidth(getNullableInt(rs, "width"));
                metadata.setHeight(getNullableInt(rs, "height"));
                metadata.setV4BaseCaption(rs.getString("v4_base_caption"));
                metadata.setV4CharCaptions(decodeCharCaptions(imageId, rs.getString("v4_char_captions")));
                metadata.setTags(tags.stream()
                        .filter(t -> !t.source.isUser())
                        .map(ImageTagRecord::toWeightedTag)
                        .collect(Collectors.toList()));
                return metadata;
            }
        }
    }

    private static ImageRecord mapImage(ResultSet rs, GenerationMetadata metadata, List<ImageTagRecord> tags) throws SQLException {
        return new ImageRecord(
                rs.getLong("id"),
                rs.getString("filename"),
                rs.getString("storage_key"),
                rs.getString("file_hash"),
                getNullableInt(rs, "width"),
                getNullableInt(rs, "height"),
                rs.getBoolean("has_lossless_derivative"),
                rs.getBoolean("has_metadata_file"),
                Instant.ofEpochMilli(rs.getLong("created_at")),
                metadata,
                tags);
    }

    private String encodeCharCaptions(List<CharCaption> captions) throws SQLException {
        if (captions == null) return null;
        try {
            return mapper.writeValueAsString(captions);
        } catch (JsonProcessingException e) {
            throw new SQLException("Failed to encode v4 character captions", e);
        }
    }

    private List<CharCaption> decodeCharCaptions(long imageId, String json) {
        if (json == null) return null;
        try {
            return mapper.readValue(json, CHAR_CAPTIONS);
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable v4 character captions for image {}", imageId, e);
            return null;
        }
    }

    private static void setNullableInt(PreparedStatement pstmt, int index, Integer value) throws SQLException {
        if (value != null) pstmt.setInt(index, value);
        else pstmt.setNull(index, Types.INTEGER);
    }

    private static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }
}
