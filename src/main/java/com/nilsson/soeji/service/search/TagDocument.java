package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.nilsson.soeji.model.TagRecord;

/**
 Document of the {@code tags} collection. {@code nameTokens} is the name with {@code _ - :}
 replaced by spaces, so a query for "red eyes" reaches {@code red_eyes}.
 */
@JsonPropertyOrder({"id", "name", "nameTokens", "category", "imageCount"})
public final class TagDocument {

    private final long id;
    private final String name;
    private final String nameTokens;
    private final String category;
    private final int imageCount;

    @JsonCreator
    public TagDocument(@JsonProperty("id") long id,
                       @JsonProperty("name") String name,
                       @JsonProperty("nameTokens") String nameTokens,
                       @JsonProperty("category") String category,
                       @JsonProperty("imageCount") int imageCount) {
        this.id = id;
        this.name = name;
        this.nameTokens = nameTokens;
        this.category = category;
        this.imageCount = imageCount;
    }

    public static TagDocument of(TagRecord tag, int imageCount) {
        return new TagDocument(tag.id, tag.name, tokenize(tag.name), tag.category, imageCount);
    }

    public static String tokenize(String name) {
        return name.replaceAll("[_\\-:]", " ");
    }

    @JsonProperty("id")
    public long getId() {
        return id;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("nameTokens")
    public String getNameTokens() {
        return nameTokens;
    }

    @JsonProperty("category")
    public String getCategory() {
        return category;
    }

    @JsonProperty("imageCount")
    public int getImageCount() {
        return imageCount;
    }

    @Override
    public String toString() {
        return "TagDocument{" + id + ", " + name + ", imageCount=" + imageCount + "}";
    }
}
