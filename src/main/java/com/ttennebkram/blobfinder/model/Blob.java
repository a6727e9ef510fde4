package com.ttennebkram.blobfinder.model;

import com.google.gson.JsonObject;
import org.opencv.core.KeyPoint;

import java.util.Objects;

/**
 * A detected blob: center in pixel coordinates and diameter in pixels.
 */
public final class Blob {

    private final double x;
    private final double y;
    private final double size;

    public Blob(double x, double y, double size) {
        this.x = x;
        this.y = y;
        this.size = size;
    }

    /**
     * Build a blob from a keypoint reported by SimpleBlobDetector.
     * KeyPoint.size is the blob diameter.
     */
    public static Blob fromKeyPoint(KeyPoint keyPoint) {
        return new Blob(keyPoint.pt.x, keyPoint.pt.y, keyPoint.size);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    /** Diameter in pixels. */
    public double getSize() {
        return size;
    }

    public double getRadius() {
        return size / 2.0;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("x", x);
        json.addProperty("y", y);
        json.addProperty("size", size);
        return json;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Blob)) return false;
        Blob other = (Blob) o;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(size, other.size) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, size);
    }

    @Override
    public String toString() {
        return String.format("Blob(x=%.2f, y=%.2f, size=%.2f)", x, y, size);
    }
}
