package com.ttennebkram.blobfinder.processing;

import org.opencv.core.Mat;

/**
 * Interface for single-input OpenCV stages.
 * Takes a Mat and returns a newly allocated Mat.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * Process an input image and return the result.
     *
     * @param input The input image (caller owns this Mat)
     * @return The processed output image (caller must release when done)
     */
    Mat process(Mat input);
}
