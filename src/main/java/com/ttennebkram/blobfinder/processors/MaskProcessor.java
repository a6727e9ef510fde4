package com.ttennebkram.blobfinder.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.blobfinder.DimensionMismatchException;
import com.ttennebkram.blobfinder.processing.DualImageProcessor;
import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Mask processor.
 * Keeps the pixels of the first input where the mask is non-zero and writes
 * black everywhere else. The mask is never resized to fit.
 */
@StageInfo(
    nodeType = "Mask",
    displayName = "Mask",
    category = "Filter",
    description = "Mask\nCore.bitwise_and(src, src, dst, mask)",
    dualInput = true
)
public class MaskProcessor extends StageProcessorBase implements DualImageProcessor {

    /**
     * @param input The color image to filter
     * @param mask  Single-channel 8-bit mask with the input's width and height
     * @return The masked image, same type as the input
     */
    @Override
    public Mat process(Mat input, Mat mask) {
        requireImage(input, "input");
        requireType(mask, "mask", 1);
        if (!input.size().equals(mask.size())) {
            throw new DimensionMismatchException(getNodeType() + " mask size", input.size(), mask.size());
        }

        Mat output = new Mat();
        Core.bitwise_and(input, input, output, mask);
        return output;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        // No parameters
    }
}
