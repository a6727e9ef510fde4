package com.ttennebkram.blobfinder.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.blobfinder.model.ColorRange;
import com.ttennebkram.blobfinder.processing.ImageProcessor;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * HSL threshold processor.
 * Converts a BGR image to OpenCV's HLS layout and marks every pixel whose hue,
 * saturation and luminance all fall inside their ranges. The output is a
 * single-channel mask with 255 for members and 0 elsewhere.
 *
 * <p>Ranges are plain closed intervals on OpenCV's 8-bit scale (hue 0-180).
 * Hue does not wrap around the color wheel.
 */
@StageInfo(
    nodeType = "HSLThreshold",
    displayName = "HSL Threshold",
    category = "Color",
    description = "HSL threshold\nImgproc.cvtColor(src, hls, COLOR_BGR2HLS); Core.inRange(hls, lowerb, upperb, dst)"
)
public class HslThresholdProcessor extends StageProcessorBase implements ImageProcessor {

    private final ColorRange hue;
    private final ColorRange saturation;
    private final ColorRange luminance;

    public HslThresholdProcessor(ColorRange hue, ColorRange saturation, ColorRange luminance) {
        if (hue == null || saturation == null || luminance == null) {
            throw new IllegalArgumentException("hue, saturation and luminance ranges are required");
        }
        this.hue = hue;
        this.saturation = saturation;
        this.luminance = luminance;
    }

    @Override
    public Mat process(Mat input) {
        requireType(input, "input", 3);

        Mat hls = new Mat();
        Imgproc.cvtColor(input, hls, Imgproc.COLOR_BGR2HLS);

        // HLS channel order is H, L, S
        Mat mask = new Mat();
        Core.inRange(hls,
                new Scalar(hue.getMin(), luminance.getMin(), saturation.getMin()),
                new Scalar(hue.getMax(), luminance.getMax(), saturation.getMax()),
                mask);

        hls.release();
        return mask;
    }

    @Override
    public void serializeProperties(JsonObject json) {
        json.add("hueRange", hue.toJson());
        json.add("satRange", saturation.toJson());
        json.add("lumRange", luminance.toJson());
    }

    public ColorRange getHue() {
        return hue;
    }

    public ColorRange getSaturation() {
        return saturation;
    }

    public ColorRange getLuminance() {
        return luminance;
    }
}
