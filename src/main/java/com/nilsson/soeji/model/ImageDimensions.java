package com.nilsson.soeji.model;

import java.util.Objects;

/**
 Pixel size read from a PNG {@code IHDR} chunk.
 */
public final class ImageDimensions {

    private final int width;
    private final int height;

    public ImageDimensions(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageDimensions)) return false;
        ImageDimensions that = (ImageDimensions) o;
        return width == that.width && height == that.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
