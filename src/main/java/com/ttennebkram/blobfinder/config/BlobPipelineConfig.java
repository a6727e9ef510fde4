package com.ttennebkram.blobfinder.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.ttennebkram.blobfinder.model.ColorRange;
import com.ttennebkram.blobfinder.processors.BlurType;

import java.util.Objects;

/**
 * Immutable parameters of a blob pipeline, fixed when the pipeline is built.
 *
 * <p>Builder defaults are the tuned lemon-detection thresholds, see {@link #lemonDefaults()}.
 * Hue is on OpenCV's 8-bit scale (0-180); saturation and luminance are 0-255.
 */
public final class BlobPipelineConfig {

    public static final String BLUR_TYPE = "blurType";
    public static final String BLUR_RADIUS = "blurRadius";
    public static final String HUE_RANGE = "hueRange";
    public static final String SAT_RANGE = "satRange";
    public static final String LUM_RANGE = "lumRange";
    public static final String MIN_BLOB_AREA = "minBlobArea";
    public static final String CIRCULARITY_RANGE = "circularityRange";
    public static final String DARK_BLOBS = "darkBlobs";

    private final BlurType blurType;
    private final double blurRadius;
    private final ColorRange hueRange;
    private final ColorRange satRange;
    private final ColorRange lumRange;
    private final double minBlobArea;
    private final ColorRange circularityRange;
    private final boolean darkBlobs;

    private BlobPipelineConfig(Builder builder) {
        this.blurType = builder.blurType;
        this.blurRadius = builder.blurRadius;
        this.hueRange = builder.hueRange;
        this.satRange = builder.satRange;
        this.lumRange = builder.lumRange;
        this.minBlobArea = builder.minBlobArea;
        this.circularityRange = builder.circularityRange;
        this.darkBlobs = builder.darkBlobs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thresholds tuned for finding a lemon under indoor lighting.
     */
    public static BlobPipelineConfig lemonDefaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
                .blurType(blurType)
                .blurRadius(blurRadius)
                .hueRange(hueRange)
                .satRange(satRange)
                .lumRange(lumRange)
                .minBlobArea(minBlobArea)
                .circularityRange(circularityRange)
                .darkBlobs(darkBlobs);
    }

    public BlurType getBlurType() {
        return blurType;
    }

    public double getBlurRadius() {
        return blurRadius;
    }

    public ColorRange getHueRange() {
        return hueRange;
    }

    public ColorRange getSatRange() {
        return satRange;
    }

    public ColorRange getLumRange() {
        return lumRange;
    }

    public double getMinBlobArea() {
        return minBlobArea;
    }

    public ColorRange getCircularityRange() {
        return circularityRange;
    }

    public boolean isDarkBlobs() {
        return darkBlobs;
    }

    /**
     * Convert to a JSON tree using the recognized field names.
     * Ranges become [min, max] arrays and the blur type its display name.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty(BLUR_TYPE, blurType.getDisplayName());
        json.addProperty(BLUR_RADIUS, blurRadius);
        json.add(HUE_RANGE, hueRange.toJson());
        json.add(SAT_RANGE, satRange.toJson());
        json.add(LUM_RANGE, lumRange.toJson());
        json.addProperty(MIN_BLOB_AREA, minBlobArea);
        json.add(CIRCULARITY_RANGE, circularityRange.toJson());
        json.addProperty(DARK_BLOBS, darkBlobs);
        return json;
    }

    /**
     * Build a configuration from a JSON tree. Missing fields keep the builder defaults.
     *
     * @throws IllegalArgumentException if a field has the wrong shape or an invalid value
     */
    public static BlobPipelineConfig fromJson(JsonObject json) {
        if (json == null) {
            throw new IllegalArgumentException("Configuration JSON must not be null");
        }
        Builder builder = builder();
        try {
            if (json.has(BLUR_TYPE)) builder.blurType(BlurType.fromName(json.get(BLUR_TYPE).getAsString()));
            if (json.has(BLUR_RADIUS)) builder.blurRadius(json.get(BLUR_RADIUS).getAsDouble());
            if (json.has(HUE_RANGE)) builder.hueRange(getRange(json, HUE_RANGE));
            if (json.has(SAT_RANGE)) builder.satRange(getRange(json, SAT_RANGE));
            if (json.has(LUM_RANGE)) builder.lumRange(getRange(json, LUM_RANGE));
            if (json.has(MIN_BLOB_AREA)) builder.minBlobArea(json.get(MIN_BLOB_AREA).getAsDouble());
            if (json.has(CIRCULARITY_RANGE)) builder.circularityRange(getRange(json, CIRCULARITY_RANGE));
            if (json.has(DARK_BLOBS)) builder.darkBlobs(json.get(DARK_BLOBS).getAsBoolean());
        } catch (ClassCastException | IllegalStateException | UnsupportedOperationException
                | NumberFormatException e) {
            throw new IllegalArgumentException("Malformed pipeline configuration: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static ColorRange getRange(JsonObject json, String key) {
        JsonElement element = json.get(key);
        if (!element.isJsonArray() || element.getAsJsonArray().size() != 2) {
            throw new IllegalArgumentException(key + " must be a [min, max] array but was " + element);
        }
        JsonArray array = element.getAsJsonArray();
        try {
            return new ColorRange(array.get(0).getAsDouble(), array.get(1).getAsDouble());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BlobPipelineConfig)) return false;
        BlobPipelineConfig other = (BlobPipelineConfig) o;
        return blurType == other.blurType
                && Double.compare(blurRadius, other.blurRadius) == 0
                && hueRange.equals(other.hueRange)
                && satRange.equals(other.satRange)
                && lumRange.equals(other.lumRange)
                && Double.compare(minBlobArea, other.minBlobArea) == 0
                && circularityRange.equals(other.circularityRange)
                && darkBlobs == other.darkBlobs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(blurType, blurRadius, hueRange, satRange, lumRange,
                minBlobArea, circularityRange, darkBlobs);
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    /**
     * Builder for {@link BlobPipelineConfig}. Every value is validated in {@link #build()}.
     */
    public static final class Builder {
        private BlurType blurType = BlurType.GAUSSIAN;
        private double blurRadius = 6.306306306306306;
        private ColorRange hueRange = new ColorRange(19.424460431654676, 29.48805460750853);
        private ColorRange satRange = new ColorRange(119.24460431654676, 255.0);
        private ColorRange lumRange = new ColorRange(75.67446043165468, 255.0);
        private double minBlobArea = 2000.0;
        private ColorRange circularityRange = new ColorRange(0.0, 1.0);
        private boolean darkBlobs = false;

        private Builder() {
        }

        public Builder blurType(BlurType blurType) {
            this.blurType = blurType;
            return this;
        }

        public Builder blurRadius(double blurRadius) {
            this.blurRadius = blurRadius;
            return this;
        }

        public Builder hueRange(ColorRange hueRange) {
            this.hueRange = hueRange;
            return this;
        }

        public Builder hueRange(double min, double max) {
            return hueRange(new ColorRange(min, max));
        }

        public Builder satRange(ColorRange satRange) {
            this.satRange = satRange;
            return this;
        }

        public Builder satRange(double min, double max) {
            return satRange(new ColorRange(min, max));
        }

        public Builder lumRange(ColorRange lumRange) {
            this.lumRange = lumRange;
            return this;
        }

        public Builder lumRange(double min, double max) {
            return lumRange(new ColorRange(min, max));
        }

        public Builder minBlobArea(double minBlobArea) {
            this.minBlobArea = minBlobArea;
            return this;
        }

        public Builder circularityRange(ColorRange circularityRange) {
            this.circularityRange = circularityRange;
            return this;
        }

        public Builder circularityRange(double min, double max) {
            return circularityRange(new ColorRange(min, max));
        }

        public Builder darkBlobs(boolean darkBlobs) {
            this.darkBlobs = darkBlobs;
            return this;
        }

        public BlobPipelineConfig build() {
            if (blurType == null) {
                throw new IllegalArgumentException(BLUR_TYPE + " must not be null");
            }
            if (!Double.isFinite(blurRadius) || blurRadius <= 0) {
                throw new IllegalArgumentException(BLUR_RADIUS + " must be > 0 but was " + blurRadius);
            }
            if (hueRange == null || satRange == null || lumRange == null) {
                throw new IllegalArgumentException(HUE_RANGE + ", " + SAT_RANGE + " and " + LUM_RANGE + " are required");
            }
            if (!Double.isFinite(minBlobArea) || minBlobArea < 0) {
                throw new IllegalArgumentException(MIN_BLOB_AREA + " must be >= 0 but was " + minBlobArea);
            }
            if (circularityRange == null) {
                throw new IllegalArgumentException(CIRCULARITY_RANGE + " must not be null");
            }
            if (circularityRange.getMin() < 0.0 || circularityRange.getMax() > 1.0) {
                throw new IllegalArgumentException(CIRCULARITY_RANGE + " must lie within [0, 1] but was "
                        + circularityRange);
            }
            return new BlobPipelineConfig(this);
        }
    }
}
