package com.ttennebkram.blobfinder.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ttennebkram.blobfinder.model.ColorRange;
import com.ttennebkram.blobfinder.processors.BlurType;
import org.junit.jupiter.api.Test;

class BlobPipelineConfigTest {

    @Test
    void lemonDefaultsMatchTunedThresholds() {
        BlobPipelineConfig config = BlobPipelineConfig.lemonDefaults();

        assertEquals(BlurType.GAUSSIAN, config.getBlurType());
        assertEquals(6.306306306306306, config.getBlurRadius());
        assertEquals(ColorRange.of(19.424460431654676, 29.48805460750853), config.getHueRange());
        assertEquals(ColorRange.of(119.24460431654676, 255.0), config.getSatRange());
        assertEquals(ColorRange.of(75.67446043165468, 255.0), config.getLumRange());
        assertEquals(2000.0, config.getMinBlobArea());
        assertEquals(ColorRange.of(0.0, 1.0), config.getCircularityRange());
        assertFalse(config.isDarkBlobs());
    }

    @Test
    void builderOverridesSelectedFields() {
        BlobPipelineConfig config = BlobPipelineConfig.builder()
                .blurType(BlurType.MEDIAN)
                .blurRadius(2)
                .minBlobArea(500)
                .circularityRange(0.8, 1.0)
                .darkBlobs(true)
                .build();

        assertEquals(BlurType.MEDIAN, config.getBlurType());
        assertEquals(500.0, config.getMinBlobArea());
        assertTrue(config.isDarkBlobs());
        assertEquals(BlobPipelineConfig.lemonDefaults().getHueRange(), config.getHueRange());
    }

    @Test
    void rejectsParameterViolations() {
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.builder().blurRadius(0).build());
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.builder().blurRadius(-3).build());
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.builder().blurType(null).build());
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.builder().minBlobArea(-1).build());
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.builder().circularityRange(0.9, 0.8));
        assertThrows(IllegalArgumentException.class,
                () -> BlobPipelineConfig.builder().circularityRange(0.5, 1.2).build());
        assertThrows(IllegalArgumentException.class,
                () -> BlobPipelineConfig.builder().hueRange((ColorRange) null).build());
    }

    @Test
    void jsonUsesRecognizedFieldNames() {
        JsonObject json = BlobPipelineConfig.lemonDefaults().toJson();

        assertEquals("Gaussian Blur", json.get("blurType").getAsString());
        assertTrue(json.has("blurRadius"));
        assertTrue(json.get("hueRange").isJsonArray());
        assertTrue(json.get("satRange").isJsonArray());
        assertTrue(json.get("lumRange").isJsonArray());
        assertEquals(2000.0, json.get("minBlobArea").getAsDouble());
        assertTrue(json.get("circularityRange").isJsonArray());
        assertFalse(json.get("darkBlobs").getAsBoolean());
        assertEquals(BlobPipelineConfig.lemonDefaults(), BlobPipelineConfig.fromJson(json));
    }

    @Test
    void fromJsonFillsMissingFieldsWithDefaults() {
        JsonObject json = JsonParser.parseString(
                "{\"blurType\": \"Box Blur\", \"blurRadius\": 1, \"circularityRange\": [0.8, 1.0]}")
                .getAsJsonObject();

        BlobPipelineConfig config = BlobPipelineConfig.fromJson(json);

        assertEquals(BlurType.BOX, config.getBlurType());
        assertEquals(1.0, config.getBlurRadius());
        assertEquals(ColorRange.of(0.8, 1.0), config.getCircularityRange());
        assertEquals(2000.0, config.getMinBlobArea());
    }

    @Test
    void fromJsonRejectsMalformedFields() {
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.fromJson(
                JsonParser.parseString("{\"hueRange\": [10]}").getAsJsonObject()));
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.fromJson(
                JsonParser.parseString("{\"hueRange\": [30, 10]}").getAsJsonObject()));
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.fromJson(
                JsonParser.parseString("{\"blurRadius\": \"wide\"}").getAsJsonObject()));
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.fromJson(
                JsonParser.parseString("{\"blurType\": \"Zoom Blur\"}").getAsJsonObject()));
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.fromJson(
                JsonParser.parseString("{\"minBlobArea\": {}}").getAsJsonObject()));
        assertThrows(IllegalArgumentException.class, () -> BlobPipelineConfig.fromJson(null));
    }
}
