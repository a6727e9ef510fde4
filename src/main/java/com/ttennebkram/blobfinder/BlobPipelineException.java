package com.ttennebkram.blobfinder;

/**
 * Base class for failures raised while running the blob pipeline.
 * Every pipeline failure is fatal for the call that raised it.
 */
public class BlobPipelineException extends RuntimeException {

    public BlobPipelineException(String message) {
        super(message);
    }

    public BlobPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
