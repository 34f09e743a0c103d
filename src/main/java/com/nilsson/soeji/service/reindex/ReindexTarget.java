package com.nilsson.soeji.service.reindex;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 Repair jobs of the reindex tool, in the order a full run executes them.
 */
public enum ReindexTarget {

    LOSSLESS_DERIVATIVE("lossless-derivative", "lossless-webp"),
    METADATA_SIDECAR("metadata-sidecar", "metadata-json"),
    REINDEX_IMAGES("reindex-images", "images"),
    REINDEX_TAGS("reindex-tags", "tags");

    private final String wireName;
    private final String alias;

    ReindexTarget(String wireName, String alias) {
        this.wireName = wireName;
        this.alias = alias;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     Accepts the command-line name or its short alias, case-insensitively.

     @throws IllegalArgumentException for any other value
     */
    public static ReindexTarget fromWireName(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (ReindexTarget target : values()) {
            if (target.wireName.equals(normalized) || target.alias.equals(normalized)) {
                return target;
            }
        }
        throw new IllegalArgumentException("Unknown target '" + value + "'. Valid targets: " + validNames());
    }

    public static String validNames() {
        return Arrays.stream(values()).map(ReindexTarget::getWireName).collect(Collectors.joining(", "));
    }

    @Override
    public String toString() {
        return wireName;
    }
}
