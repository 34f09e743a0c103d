package com.nilsson.soeji.service.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.nilsson.soeji.model.ImageTagRecord;

/**
 Entry of the {@code weightedTags} attribute of an image document.
 */
@JsonPropertyOrder({"name", "weight", "isNegative", "source"})
public final class WeightedTagDocument {

    private final String name;
    private final double weight;
    private final boolean negative;
    private final String source;

    @JsonCreator
    public WeightedTagDocument(@JsonProperty("name") String name,
                               @JsonProperty("weight") double weight,
                               @JsonProperty("isNegative") boolean negative,
                               @JsonProperty("source") String source) {
        this.name = name;
        this.weight = weight;
        this.negative = negative;
        this.source = source;
    }

    public static WeightedTagDocument of(ImageTagRecord tag) {
        return new WeightedTagDocument(tag.tagName, tag.weight, tag.negative, tag.source.wireName());
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("weight")
    public double getWeight() {
        return weight;
    }

    @JsonProperty("isNegative")
    public boolean isNegative() {
        return negative;
    }

    @JsonProperty("source")
    public String getSource() {
        return source;
    }
}
