package com.nilsson.soeji.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 A normalized tag extracted from a prompt field.
 <p>
 The name is lowercase with whitespace runs collapsed to underscores. The weight is never
 negative; negativity is carried by {@link #isNegative()}.
 </p>
 */
public final class WeightedTag {

    private final String name;
    private final double weight;
    private final boolean negative;
    private final TagSource source;

    @JsonCreator
    public WeightedTag(@JsonProperty("name") String name,
                       @JsonProperty("weight") double weight,
                       @JsonProperty("isNegative") boolean negative,
                       @JsonProperty("source") TagSource source) {
        this.name = Objects.requireNonNull(name, "name");
        this.weight = weight;
        this.negative = negative;
        this.source = Objects.requireNonNull(source, "source");
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
    public TagSource getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WeightedTag)) return false;
        WeightedTag that = (WeightedTag) o;
        return Double.compare(that.weight, weight) == 0
                && negative == that.negative
                && name.equals(that.name)
                && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, weight, negative, source);
    }

    @Override
    public String toString() {
        return "WeightedTag{" + name + ", weight=" + weight + ", negative=" + negative + ", source=" + source.wireName() + "}";
    }
}
