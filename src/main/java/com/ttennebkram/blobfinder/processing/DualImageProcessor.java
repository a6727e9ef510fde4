package com.ttennebkram.blobfinder.processing;

import org.opencv.core.Mat;

/**
 * Functional interface for stages that combine two input images,
 * such as applying a mask to a color image.
 */
@FunctionalInterface
public interface DualImageProcessor {
    /**
     * Process two input images and return the result.
     *
     * @param input1 First input image (caller owns this Mat)
     * @param input2 Second input image (caller owns this Mat)
     * @return Processed output image (caller must release when done)
     */
    Mat process(Mat input1, Mat input2);
}
