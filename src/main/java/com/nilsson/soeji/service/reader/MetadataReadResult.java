package com.nilsson.soeji.service.reader;

import com.nilsson.soeji.model.GenerationMetadata;

/**
 Outcome of reading an image's embedded metadata: the format that claimed the buffer and the
 parsed record. The record is never null; images without metadata carry an empty one.
 */
public final class MetadataReadResult {

    public static final String UNKNOWN_FORMAT = "unknown";

    private final String format;
    private final GenerationMetadata metadata;

    public MetadataReadResult(String format, GenerationMetadata metadata) {
        this.format = format;
        this.metadata = metadata == null ? GenerationMetadata.empty("") : metadata;
    }

    public static MetadataReadResult unknown() {
        return new MetadataReadResult(UNKNOWN_FORMAT, GenerationMetadata.empty(""));
    }

    public String getFormat() {
        return format;
    }

    public GenerationMetadata getMetadata() {
        return metadata;
    }

    public boolean isKnownFormat() {
        return !UNKNOWN_FORMAT.equals(format);
    }
}
