package com.ttennebkram.blobfinder;

/**
 * Thrown when an image is null, empty, or has a channel layout or depth
 * a stage cannot handle. Also wraps OpenCV failures raised inside a stage.
 */
public class InvalidImageException extends BlobPipelineException {

    public InvalidImageException(String message) {
        super(message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
