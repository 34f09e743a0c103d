package com.nilsson.soeji.model;

/**
 Usage counts of one tag across all images, split the way popularity evaluation needs them.
 */
public class TagStats {

    public final TagRecord tag;
    public final int metadataPositive;
    public final int metadataNegative;
    public final int user;

    public TagStats(TagRecord tag, int metadataPositive, int metadataNegative, int user) {
        this.tag = tag;
        this.metadataPositive = metadataPositive;
        this.metadataNegative = metadataNegative;
        this.user = user;
    }
}
