package com.nilsson.soeji.model;

/**
 An image-to-tag association joined with the tag's name and category.
 */
public class ImageTagRecord {

    public final long tagId;
    public final String tagName;
    public final String category;
    public final double weight;
    public final boolean negative;
    public final TagSource source;

    public ImageTagRecord(long tagId, String tagName, String category, double weight, boolean negative, TagSource source) {
        this.tagId = tagId;
        this.tagName = tagName;
        this.category = category;
        this.weight = weight;
        this.negative = negative;
        this.source = source;
    }

    public WeightedTag toWeightedTag() {
        return new WeightedTag(tagName, weight, negative, source);
    }
}
