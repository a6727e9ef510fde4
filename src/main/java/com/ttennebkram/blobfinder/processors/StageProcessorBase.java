package com.ttennebkram.blobfinder.processors;

import com.ttennebkram.blobfinder.InvalidImageException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Abstract base class for pipeline stages.
 * Provides metadata from {@link StageInfo} and common input checks.
 */
public abstract class StageProcessorBase implements StageProcessor {

    private StageInfo info() {
        StageInfo info = getClass().getAnnotation(StageInfo.class);
        if (info == null) {
            throw new IllegalStateException(getClass().getName() + " is missing @StageInfo");
        }
        return info;
    }

    @Override
    public String getNodeType() {
        return info().nodeType();
    }

    @Override
    public String getDisplayName() {
        StageInfo info = info();
        return info.displayName().isEmpty() ? info.nodeType() : info.displayName();
    }

    @Override
    public String getCategory() {
        return info().category();
    }

    @Override
    public String getDescription() {
        return info().description();
    }

    @Override
    public boolean isDualInput() {
        return info().dualInput();
    }

    /**
     * Standard null/empty check for input validation.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    /**
     * Throw InvalidImageException if the input is null or empty.
     */
    protected void requireImage(Mat input, String what) {
        if (isInvalidInput(input)) {
            throw new InvalidImageException(getNodeType() + ": " + what + " is null or empty");
        }
    }

    /**
     * Throw InvalidImageException unless the input is 8-bit with the given channel count.
     */
    protected void requireType(Mat input, String what, int channels) {
        requireImage(input, what);
        if (input.depth() != CvType.CV_8U || input.channels() != channels) {
            throw new InvalidImageException(getNodeType() + ": " + what + " must be "
                    + CvType.typeToString(CvType.CV_8UC(channels)) + " but was "
                    + CvType.typeToString(input.type()));
        }
    }
}
