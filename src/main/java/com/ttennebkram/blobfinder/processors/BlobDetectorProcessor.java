package com.ttennebkram.blobfinder.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.blobfinder.InvalidImageException;
import com.ttennebkram.blobfinder.model.Blob;
import com.ttennebkram.blobfinder.model.ColorRange;
import org.opencv.core.CvException;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.features2d.SimpleBlobDetector;
import org.opencv.features2d.SimpleBlobDetector_Params;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Find Blobs processor.
 * Runs SimpleBlobDetector with a fixed threshold sweep and reports the blobs
 * that pass the area and circularity filters. Convexity and inertia filters
 * stay disabled.
 */
@StageInfo(
    nodeType = "FindBlobs",
    displayName = "Find Blobs",
    category = "Detection",
    description = "Find blobs\nSimpleBlobDetector.create(params).detect(image, keypoints)"
)
public class BlobDetectorProcessor extends StageProcessorBase {

    private static final Logger LOG = LoggerFactory.getLogger(BlobDetectorProcessor.class);

    /** Lowest threshold of the detector's binarization sweep. */
    public static final int MIN_THRESHOLD = 10;
    /** Highest threshold of the detector's binarization sweep. */
    public static final int MAX_THRESHOLD = 220;

    public static final boolean FILTER_BY_CONVEXITY = false;
    public static final boolean FILTER_BY_INERTIA = false;

    static final int DARK_BLOB_COLOR = 0;
    static final int BRIGHT_BLOB_COLOR = 255;

    private static final Pattern BLOB_COLOR_ENTRY = Pattern.compile("(?m)^blobColor:[ \\t]*\\d+");

    private final double minArea;
    private final ColorRange circularity;
    private final boolean darkBlobs;
    private final SimpleBlobDetector detector;

    public BlobDetectorProcessor(double minArea, ColorRange circularity, boolean darkBlobs) {
        if (!Double.isFinite(minArea) || minArea < 0) {
            throw new IllegalArgumentException("minBlobArea must be >= 0 but was " + minArea);
        }
        if (circularity == null) {
            throw new IllegalArgumentException("circularityRange must not be null");
        }
        if (circularity.getMin() < 0.0 || circularity.getMax() > 1.0) {
            throw new IllegalArgumentException("circularityRange must lie within [0, 1] but was " + circularity);
        }
        this.minArea = minArea;
        this.circularity = circularity;
        this.darkBlobs = darkBlobs;
        this.detector = createDetector(buildParams(), darkBlobs ? DARK_BLOB_COLOR : BRIGHT_BLOB_COLOR);
    }

    private SimpleBlobDetector_Params buildParams() {
        SimpleBlobDetector_Params params = new SimpleBlobDetector_Params();
        params.set_minThreshold(MIN_THRESHOLD);
        params.set_maxThreshold(MAX_THRESHOLD);

        params.set_filterByArea(true);
        params.set_minArea((float) minArea);
        params.set_maxArea(Float.MAX_VALUE);

        // Detector keeps minCircularity <= ratio < maxCircularity, compared against floats
        params.set_filterByCircularity(true);
        params.set_minCircularity(floatAtOrBelow(circularity.getMin()));
        params.set_maxCircularity(Math.nextUp(floatAtOrAbove(circularity.getMax())));

        params.set_filterByConvexity(FILTER_BY_CONVEXITY);
        params.set_filterByInertia(FILTER_BY_INERTIA);

        params.set_filterByColor(true);
        return params;
    }

    private static float floatAtOrBelow(double value) {
        float f = (float) value;
        return f > value ? Math.nextDown(f) : f;
    }

    private static float floatAtOrAbove(double value) {
        float f = (float) value;
        return f < value ? Math.nextUp(f) : f;
    }

    /**
     * blobColor has no setter in the Java bindings and defaults to 0, so any other
     * color goes through the detector's own parameter file: write, patch, read back.
     */
    private static SimpleBlobDetector createDetector(SimpleBlobDetector_Params params, int blobColor) {
        SimpleBlobDetector detector = SimpleBlobDetector.create(params);
        if (blobColor == DARK_BLOB_COLOR) {
            return detector;
        }
        Path file = null;
        try {
            file = Files.createTempFile("blob-detector", ".yml");
            detector.write(file.toString());
            String yaml = Files.readString(file, StandardCharsets.UTF_8);
            Matcher matcher = BLOB_COLOR_ENTRY.matcher(yaml);
            if (!matcher.find()) {
                throw new IllegalStateException("SimpleBlobDetector parameters have no blobColor entry");
            }
            Files.writeString(file, matcher.replaceFirst("blobColor: " + blobColor), StandardCharsets.UTF_8);
            detector.read(file.toString());
            LOG.debug("SimpleBlobDetector blobColor set to {}", blobColor);
            return detector;
        } catch (IOException e) {
            throw new UncheckedIOException("Could not set SimpleBlobDetector blobColor", e);
        } finally {
            if (file != null) {
                deleteQuietly(file);
            }
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOG.warn("Could not delete detector parameter file {}", file, e);
        }
    }

    /**
     * Detect blobs in an 8-bit image with one, three (BGR) or four (BGRA) channels.
     *
     * @param input The image to scan (caller owns this Mat)
     * @return The detected blobs, in no particular order; empty if none qualify
     */
    public List<Blob> detect(Mat input) {
        requireImage(input, "input");

        Mat gray = toGray(input);
        MatOfKeyPoint keypoints = new MatOfKeyPoint();
        try {
            detector.detect(gray, keypoints);

            List<Blob> blobs = new ArrayList<>();
            for (KeyPoint keyPoint : keypoints.toArray()) {
                blobs.add(Blob.fromKeyPoint(keyPoint));
            }
            LOG.debug("Found {} blobs ({} keypoints)", blobs.size(), keypoints.rows());
            return blobs;
        } catch (CvException e) {
            throw new InvalidImageException(getNodeType() + ": OpenCV rejected the input image", e);
        } finally {
            keypoints.release();
            if (gray != input) {
                gray.release();
            }
        }
    }

    private Mat toGray(Mat input) {
        int code;
        switch (input.channels()) {
            case 1:
                return input;
            case 3:
                code = Imgproc.COLOR_BGR2GRAY;
                break;
            case 4:
                code = Imgproc.COLOR_BGRA2GRAY;
                break;
            default:
                throw new InvalidImageException(getNodeType() + ": unsupported channel count " + input.channels());
        }
        Mat gray = new Mat();
        Imgproc.cvtColor(input, gray, code);
        return gray;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("minBlobArea", minArea);
        json.add("circularityRange", circularity.toJson());
        json.addProperty("darkBlobs", darkBlobs);
        json.addProperty("blobColor", darkBlobs ? DARK_BLOB_COLOR : BRIGHT_BLOB_COLOR);
        json.addProperty("minThreshold", MIN_THRESHOLD);
        json.addProperty("maxThreshold", MAX_THRESHOLD);
        json.addProperty("filterByConvexity", FILTER_BY_CONVEXITY);
        json.addProperty("filterByInertia", FILTER_BY_INERTIA);
    }

    public double getMinArea() {
        return minArea;
    }

    public ColorRange getCircularity() {
        return circularity;
    }

    public boolean isDarkBlobs() {
        return darkBlobs;
    }
}
