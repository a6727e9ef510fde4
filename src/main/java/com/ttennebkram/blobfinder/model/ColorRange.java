package com.ttennebkram.blobfinder.model;

import com.google.gson.JsonArray;

import java.util.Objects;

/**
 * Closed interval [min, max] over one channel or measure.
 * Both ends are inclusive. Ranges never wrap, so min must not exceed max.
 */
public final class ColorRange {

    private final double min;
    private final double max;

    public ColorRange(double min, double max) {
        if (!Double.isFinite(min) || !Double.isFinite(max)) {
            throw new IllegalArgumentException("Range bounds must be finite: [" + min + ", " + max + "]");
        }
        if (min > max) {
            throw new IllegalArgumentException("Range min " + min + " is greater than max " + max);
        }
        this.min = min;
        this.max = max;
    }

    public static ColorRange of(double min, double max) {
        return new ColorRange(min, max);
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    /**
     * Two-element JSON array [min, max].
     */
    public JsonArray toJson() {
        JsonArray array = new JsonArray();
        array.add(min);
        array.add(max);
        return array;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColorRange)) return false;
        ColorRange other = (ColorRange) o;
        return Double.compare(min, other.min) == 0 && Double.compare(max, other.max) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(min, max);
    }

    @Override
    public String toString() {
        return "[" + min + ", " + max + "]";
    }
}
