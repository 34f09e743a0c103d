package com.nilsson.soeji.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 One per-character caption of a v4 structured prompt, with the normalized positions the
 generator placed the character at.
 */
public final class CharCaption {

    private final String charCaption;
    private final List<Center> centers;

    @JsonCreator
    public CharCaption(@JsonProperty("char_caption") String charCaption,
                       @JsonProperty("centers") List<Center> centers) {
        this.charCaption = charCaption;
        this.centers = centers == null ? Collections.emptyList() : List.copyOf(centers);
    }

    @JsonProperty("char_caption")
    public String getCharCaption() {
        return charCaption;
    }

    @JsonProperty("centers")
    public List<Center> getCenters() {
        return centers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CharCaption)) return false;
        CharCaption that = (CharCaption) o;
        return Objects.equals(charCaption, that.charCaption) && centers.equals(that.centers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(charCaption, centers);
    }

    public static final class Center {
        private final double x;
        private final double y;

        @JsonCreator
        public Center(@JsonProperty("x") double x, @JsonProperty("y") double y) {
            this.x = x;
            this.y = y;
        }

        @JsonProperty("x")
        public double getX() {
            return x;
        }

        @JsonProperty("y")
        public double getY() {
            return y;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Center)) return false;
            Center center = (Center) o;
            return Double.compare(center.x, x) == 0 && Double.compare(center.y, y) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(x, y);
        }
    }
}
