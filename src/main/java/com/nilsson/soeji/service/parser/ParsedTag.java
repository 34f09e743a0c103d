package com.nilsson.soeji.service.parser;

import java.util.Objects;

/**
 A single prompt segment after weight extraction, before a source is attached.
 */
public final class ParsedTag {

    private final String name;
    private final double weight;
    private final boolean negative;

    public ParsedTag(String name, double weight, boolean negative) {
        this.name = name;
        this.weight = weight;
        this.negative = negative;
    }

    public String getName() {
        return name;
    }

    public double getWeight() {
        return weight;
    }

    public boolean isNegative() {
        return negative;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedTag)) return false;
        ParsedTag that = (ParsedTag) o;
        return Double.compare(that.weight, weight) == 0 && negative == that.negative && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, weight, negative);
    }

    @Override
    public String toString() {
        return "ParsedTag{" + name + ", " + weight + (negative ? ", negative" : "") + "}";
    }
}
