package com.nilsson.soeji.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 A persisted image row together with its metadata row and tag associations.
 <p>
 Images are created once per unique content hash and never mutated afterwards except for the
 two derivative flags.
 </p>
 */
public class ImageRecord {

    private final long id;
    private final String filename;
    private final String storageKey;
    private final String fileHash;
    private final Integer width;
    private final Integer height;
    private final boolean hasLosslessDerivative;
    private final boolean hasMetadataFile;
    private final Instant createdAt;
    private final GenerationMetadata metadata;
    private final List<ImageTagRecord> tags;

    public ImageRecord(long id, String filename, String storageKey, String fileHash,
                       Integer width, Integer height,
                       boolean hasLosslessDerivative, boolean hasMetadataFile,
                       Instant createdAt, GenerationMetadata metadata, List<ImageTagRecord> tags) {
        this.id = id;
        this.filename = filename;
        this.storageKey = storageKey;
        this.fileHash = fileHash;
        this.width = width;
        this.height = height;
        this.hasLosslessDerivative = hasLosslessDerivative;
        this.hasMetadataFile = hasMetadataFile;
        this.createdAt = createdAt;
        this.metadata = metadata;
        this.tags = tags == null ? Collections.emptyList() : List.copyOf(tags);
    }

    public long getId() {
        return id;
    }

    public String getFilename() {
        return filename;
    }

    public String getStorageKey() {
        return storageKey;
    }

    public String getFileHash() {
        return fileHash;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public boolean hasLosslessDerivative() {
        return hasLosslessDerivative;
    }

    public boolean hasMetadataFile() {
        return hasMetadataFile;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     The metadata row, or {@code null} when the image was loaded without relations.
     */
    public GenerationMetadata getMetadata() {
        return metadata;
    }

    public List<ImageTagRecord> getTags() {
        return tags;
    }

    public ImageRecord withTags(List<ImageTagRecord> newTags) {
        return new ImageRecord(id, filename, storageKey, fileHash, width, height,
                hasLosslessDerivative, hasMetadataFile, createdAt, metadata, newTags);
    }

    @Override
    public String toString() {
        return "ImageRecord{id=" + id + ", storageKey=" + storageKey + "}";
    }
}
