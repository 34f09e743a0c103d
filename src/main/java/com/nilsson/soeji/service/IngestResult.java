package com.nilsson.soeji.service;

import com.nilsson.soeji.model.ImageRecord;

/**
 Successful outcome of an ingestion: either a new image or the image that already holds the
 same content.
 */
public final class IngestResult {

    public enum Status {CREATED, DUPLICATE}

    private final Status status;
    private final ImageRecord image;
    private final String metadataFormat;

    private IngestResult(Status status, ImageRecord image, String metadataFormat) {
        this.status = status;
        this.image = image;
        this.metadataFormat = metadataFormat;
    }

    public static IngestResult created(ImageRecord image, String metadataFormat) {
        return new IngestResult(Status.CREATED, image, metadataFormat);
    }

    public static IngestResult duplicate(ImageRecord existing) {
        return new IngestResult(Status.DUPLICATE, existing, null);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isDuplicate() {
        return status == Status.DUPLICATE;
    }

    /**
     The new image, or the existing one for a duplicate.
     */
    public ImageRecord getImage() {
        return image;
    }

    /**
     Format the metadata was read as; {@code null} for a duplicate.
     */
    public String getMetadataFormat() {
        return metadataFormat;
    }

    @Override
    public String toString() {
        return status + " " + image;
    }
}
