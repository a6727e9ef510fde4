package com.ttennebkram.blobfinder.util;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact.
 * Must be called once before any Mat is created.
 */
public final class OpenCvLoader {

    private static final Logger LOG = LoggerFactory.getLogger(OpenCvLoader.class);

    private static volatile boolean loaded = false;

    private OpenCvLoader() {
    }

    /**
     * Load the native library if this JVM has not done so yet.
     */
    public static synchronized void load() {
        if (loaded) {
            return;
        }
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        LOG.info("Loaded OpenCV {}", Core.VERSION);
    }
}
