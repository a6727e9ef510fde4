package com.ttennebkram.blobfinder;

import org.opencv.core.Size;

/**
 * Thrown when two images that must share width and height do not.
 */
public class DimensionMismatchException extends BlobPipelineException {

    private final Size expected;
    private final Size actual;

    public DimensionMismatchException(String what, Size expected, Size actual) {
        super(what + ": expected " + format(expected) + " but was " + format(actual));
        this.expected = expected;
        this.actual = actual;
    }

    public Size getExpected() {
        return expected;
    }

    public Size getActual() {
        return actual;
    }

    private static String format(Size size) {
        return (int) size.width + "x" + (int) size.height;
    }
}
