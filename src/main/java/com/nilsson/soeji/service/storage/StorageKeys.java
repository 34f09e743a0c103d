package com.nilsson.soeji.service.storage;

/**
 Content-addressed key scheme. Every artifact of an image is stored under its SHA-256 hex
 digest plus a fixed suffix.
 */
public final class StorageKeys {

    public static final String ORIGINAL_SUFFIX = ".png";
    public static final String LOSSLESS_SUFFIX = ".lossless.png";
    public static final String METADATA_SUFFIX = ".metadata.json";

    public static final String PNG_CONTENT_TYPE = "image/png";
    public static final String JSON_CONTENT_TYPE = "application/json";

    private StorageKeys() {
    }

    public static String original(String hash) {
        return hash + ORIGINAL_SUFFIX;
    }

    public static String lossless(String hash) {
        return hash + LOSSLESS_SUFFIX;
    }

    public static String metadata(String hash) {
        return hash + METADATA_SUFFIX;
    }

    /**
     Maps an original's key to the key of one of its siblings, e.g. {@code abc.png} to
     {@code abc.metadata.json}.
     */
    public static String sibling(String originalKey, String suffix) {
        String base = originalKey.endsWith(ORIGINAL_SUFFIX)
                ? originalKey.substring(0, originalKey.length() - ORIGINAL_SUFFIX.length())
                : originalKey;
        return base + suffix;
    }
}
