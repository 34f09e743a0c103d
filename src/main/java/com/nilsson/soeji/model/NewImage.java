package com.nilsson.soeji.model;

import java.time.Instant;

/**
 Values of an image row that is about to be inserted.
 */
public class NewImage {

    public final String filename;
    public final String storageKey;
    public final String fileHash;
    public final Integer width;
    public final Integer height;
    public final boolean hasLosslessDerivative;
    public final boolean hasMetadataFile;
    public final Instant createdAt;

    public NewImage(String filename, String storageKey, String fileHash, Integer width, Integer height,
                    boolean hasLosslessDerivative, boolean hasMetadataFile, Instant createdAt) {
        this.filename = filename;
        this.storageKey = storageKey;
        this.fileHash = fileHash;
        this.width = width;
        this.height = height;
        this.hasLosslessDerivative = hasLosslessDerivative;
        this.hasMetadataFile = hasMetadataFile;
        this.createdAt = createdAt;
    }
}
