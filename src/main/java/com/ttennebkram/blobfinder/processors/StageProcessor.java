package com.ttennebkram.blobfinder.processors;

import com.google.gson.JsonObject;

/**
 * Common view of a pipeline stage.
 * Each stage encapsulates:
 * - Processing logic (OpenCV operations), exposed through the stage's own process method
 * - Its fixed parameters, serialized to JSON for diagnostics
 */
public interface StageProcessor {

    /**
     * Get the node type name (e.g., "Blur", "FindBlobs").
     */
    String getNodeType();

    /**
     * Get the display name.
     */
    String getDisplayName();

    /**
     * Get the category for grouping (e.g., "Blur", "Color").
     */
    String getCategory();

    /**
     * Get a description of this stage.
     * Should include the OpenCV function signature.
     */
    String getDescription();

    /**
     * Whether this stage takes a second input image (e.g. a mask).
     */
    boolean isDualInput();

    /**
     * Serialize stage-specific parameters to JSON.
     *
     * @param json The JSON object to add properties to
     */
    void serializeProperties(JsonObject json);
}
