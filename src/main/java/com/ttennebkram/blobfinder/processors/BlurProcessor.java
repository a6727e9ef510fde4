package com.ttennebkram.blobfinder.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.blobfinder.InvalidImageException;
import com.ttennebkram.blobfinder.processing.ImageProcessor;
import org.opencv.core.CvException;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blur processor.
 * Softens an image with one of four kernels, sized from a single radius.
 * Output has the same size and channel count as the input.
 */
@StageInfo(
    nodeType = "Blur",
    displayName = "Blur",
    category = "Blur",
    description = "Blur\nImgproc.blur / GaussianBlur / medianBlur / bilateralFilter"
)
public class BlurProcessor extends StageProcessorBase implements ImageProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(BlurProcessor.class);

    private final BlurType blurType;
    private final double radius;

    public BlurProcessor(BlurType blurType, double radius) {
        if (blurType == null) {
            throw new IllegalArgumentException("blurType must not be null");
        }
        if (!Double.isFinite(radius) || radius <= 0) {
            throw new IllegalArgumentException("blurRadius must be > 0 but was " + radius);
        }
        this.blurType = blurType;
        this.radius = radius;
    }

    @Override
    public Mat process(Mat input) {
        requireImage(input, "input");

        int r = (int) Math.round(radius);
        Mat output = new Mat();
        try {
            switch (blurType) {
                case BOX: {
                    int ksize = 2 * r + 1;
                    LOG.debug("Box blur ksize={}", ksize);
                    Imgproc.blur(input, output, new Size(ksize, ksize));
                    break;
                }
                case GAUSSIAN: {
                    int ksize = 6 * r + 1;
                    LOG.debug("Gaussian blur ksize={} sigma={}", ksize, r);
                    Imgproc.GaussianBlur(input, output, new Size(ksize, ksize), r);
                    break;
                }
                case MEDIAN: {
                    int ksize = 2 * r + 1;
                    LOG.debug("Median filter ksize={}", ksize);
                    Imgproc.medianBlur(input, output, ksize);
                    break;
                }
                case BILATERAL:
                    // Diameter -1 lets OpenCV derive the neighborhood from sigmaSpace
                    LOG.debug("Bilateral filter sigmaColor={} sigmaSpace={}", r, r);
                    Imgproc.bilateralFilter(input, output, -1, r, r);
                    break;
                default:
                    throw new IllegalStateException("Unhandled blur type " + blurType);
            }
        } catch (CvException e) {
            output.release();
            throw new InvalidImageException(getNodeType() + ": OpenCV rejected the input image", e);
        }
        return output;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.addProperty("blurType", blurType.getDisplayName());
        json.addProperty("blurRadius", radius);
    }

    public BlurType getBlurType() {
        return blurType;
    }

    public double getRadius() {
        return radius;
    }
}
