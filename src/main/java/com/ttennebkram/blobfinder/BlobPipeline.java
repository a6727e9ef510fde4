package com.ttennebkram.blobfinder;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.ttennebkram.blobfinder.config.BlobPipelineConfig;
import com.ttennebkram.blobfinder.model.Blob;
import com.ttennebkram.blobfinder.processing.DualImageProcessor;
import com.ttennebkram.blobfinder.processing.ImageProcessor;
import com.ttennebkram.blobfinder.processors.BlobDetectorProcessor;
import com.ttennebkram.blobfinder.processors.BlurProcessor;
import com.ttennebkram.blobfinder.processors.HslThresholdProcessor;
import com.ttennebkram.blobfinder.processors.MaskProcessor;
import com.ttennebkram.blobfinder.processors.StageProcessor;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Fixed four-stage pipeline: Blur -> HSL Threshold -> Mask -> Find Blobs.
 *
 * <p>Every {@link #process(Mat)} call runs all stages in order on one BGR frame and
 * replaces the stored stage outputs. Outputs can only be read once a call has
 * succeeded; a failed call clears them. Returned Mats belong to the pipeline and
 * stay valid until the next process() or release() call.
 *
 * <p>Instances are not thread-safe. Separate instances share nothing and may run
 * in parallel.
 */
public class BlobPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(BlobPipeline.class);

    public enum State {
        /** Built, no successful process() yet (or outputs cleared). */
        CONFIGURED,
        /** Outputs hold the results of the last successful process(). */
        READY
    }

    private final BlobPipelineConfig config;

    private final BlurProcessor blur;
    private final HslThresholdProcessor hslThreshold;
    private final MaskProcessor mask;
    private final BlobDetectorProcessor findBlobs;

    private final ImageProcessor blurStage;
    private final ImageProcessor hslThresholdStage;
    private final DualImageProcessor maskStage;

    private State state = State.CONFIGURED;
    private Mat blurOutput;
    private Mat hslThresholdOutput;
    private Mat maskOutput;
    private List<Blob> findBlobsOutput;

    /**
     * @throws IllegalArgumentException if a stage rejects its parameters
     */
    public BlobPipeline(BlobPipelineConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        this.config = config;
        this.blur = new BlurProcessor(config.getBlurType(), config.getBlurRadius());
        this.hslThreshold = new HslThresholdProcessor(config.getHueRange(), config.getSatRange(), config.getLumRange());
        this.mask = new MaskProcessor();
        this.findBlobs = new BlobDetectorProcessor(
                config.getMinBlobArea(), config.getCircularityRange(), config.isDarkBlobs());

        this.blurStage = blur;
        this.hslThresholdStage = hslThreshold;
        this.maskStage = mask;

        LOG.info("Blob pipeline configured: {}", config);
    }

    /**
     * Run all four stages on a frame.
     *
     * @param source The BGR frame, 8 bits per channel (caller owns this Mat)
     * @return The blobs found, in no particular order
     * @throws InvalidImageException if the frame is null, empty or not CV_8UC3
     * @throws DimensionMismatchException if the mask and smoothed frame disagree in size
     */
    public List<Blob> process(Mat source) {
        Mat newBlur = null;
        Mat newThreshold = null;
        Mat newMask = null;
        try {
            validateSource(source);

            newBlur = blurStage.process(source);
            newThreshold = hslThresholdStage.process(newBlur);
            newMask = maskStage.process(newBlur, newThreshold);
            List<Blob> newBlobs = Collections.unmodifiableList(findBlobs.detect(newMask));

            releaseOutputs();
            blurOutput = newBlur;
            hslThresholdOutput = newThreshold;
            maskOutput = newMask;
            findBlobsOutput = newBlobs;
            state = State.READY;

            LOG.debug("Processed {}x{} frame, {} blobs", source.cols(), source.rows(), newBlobs.size());
            return newBlobs;
        } catch (RuntimeException e) {
            LOG.warn("Blob pipeline failed: {}", e.getMessage());
            releaseIfPresent(newBlur);
            releaseIfPresent(newThreshold);
            releaseIfPresent(newMask);
            release();
            throw e;
        }
    }

    private void validateSource(Mat source) {
        if (source == null || source.empty()) {
            throw new InvalidImageException("Source image is null or empty");
        }
        if (source.type() != CvType.CV_8UC3) {
            throw new InvalidImageException("Source image must be CV_8UC3 but was "
                    + CvType.typeToString(source.type()));
        }
    }

    /** Smoothed frame of the last successful call. */
    public Mat getBlurOutput() {
        requireReady();
        return blurOutput;
    }

    /** Single-channel HSL membership mask of the last successful call. */
    public Mat getHslThresholdOutput() {
        requireReady();
        return hslThresholdOutput;
    }

    /** Smoothed frame with non-members blacked out, from the last successful call. */
    public Mat getMaskOutput() {
        requireReady();
        return maskOutput;
    }

    /** Blobs of the last successful call (unmodifiable). */
    public List<Blob> getFindBlobsOutput() {
        requireReady();
        return findBlobsOutput;
    }

    public State getState() {
        return state;
    }

    public BlobPipelineConfig getConfig() {
        return config;
    }

    /**
     * The stages in execution order.
     */
    public List<StageProcessor> getStages() {
        return Arrays.asList(blur, hslThreshold, mask, findBlobs);
    }

    /**
     * Describe the pipeline as JSON: one entry per stage with its type and parameters.
     */
    public JsonObject describe() {
        JsonObject root = new JsonObject();
        JsonArray nodes = new JsonArray();
        List<StageProcessor> stages = getStages();
        for (int i = 0; i < stages.size(); i++) {
            StageProcessor stage = stages.get(i);
            JsonObject nodeJson = new JsonObject();
            nodeJson.addProperty("index", i);
            nodeJson.addProperty("type", stage.getNodeType());
            nodeJson.addProperty("label", stage.getDisplayName());
            nodeJson.addProperty("category", stage.getCategory());
            nodeJson.addProperty("description", stage.getDescription());
            nodeJson.addProperty("dualInput", stage.isDualInput());
            JsonObject properties = new JsonObject();
            stage.serializeProperties(properties);
            nodeJson.add("properties", properties);
            nodes.add(nodeJson);
        }
        root.add("nodes", nodes);
        root.addProperty("state", state.name());
        return root;
    }

    /**
     * Free the stored stage outputs and return to {@link State#CONFIGURED}.
     */
    public void release() {
        releaseOutputs();
        state = State.CONFIGURED;
    }

    private void releaseOutputs() {
        releaseIfPresent(blurOutput);
        releaseIfPresent(hslThresholdOutput);
        releaseIfPresent(maskOutput);
        blurOutput = null;
        hslThresholdOutput = null;
        maskOutput = null;
        findBlobsOutput = null;
    }

    private static void releaseIfPresent(Mat mat) {
        if (mat != null) {
            mat.release();
        }
    }

    private void requireReady() {
        if (state != State.READY) {
            throw new IllegalStateException("No pipeline output yet; call process() first");
        }
    }
}
