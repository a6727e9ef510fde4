package com.ttennebkram.blobfinder.processors;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.ttennebkram.blobfinder.DimensionMismatchException;
import com.ttennebkram.blobfinder.InvalidImageException;
import com.ttennebkram.blobfinder.TestImages;
import com.ttennebkram.blobfinder.util.OpenCvLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

class MaskProcessorTest {

    private final MaskProcessor maskProcessor = new MaskProcessor();

    @BeforeAll
    static void loadOpenCv() {
        OpenCvLoader.load();
    }

    @Test
    void keepsPixelsWhereMaskIsOnAndBlacksOutTheRest() {
        Mat input = TestImages.pattern(8, 6);
        Mat mask = new Mat(6, 8, CvType.CV_8UC1, new Scalar(0));
        mask.put(1, 2, 255);
        mask.put(4, 7, 255);
        mask.put(5, 0, 1);

        Mat output = maskProcessor.process(input, mask);

        for (int row = 0; row < 6; row++) {
            for (int col = 0; col < 8; col++) {
                double[] expected = mask.get(row, col)[0] != 0 ? input.get(row, col) : new double[] {0, 0, 0};
                assertArrayEquals(expected, output.get(row, col), "pixel " + row + "," + col);
            }
        }
        input.release();
        mask.release();
        output.release();
    }

    @Test
    void outputMatchesInputType() {
        Mat input = TestImages.pattern(5, 5);
        Mat mask = new Mat(5, 5, CvType.CV_8UC1, new Scalar(255));

        Mat output = maskProcessor.process(input, mask);

        assertEquals(input.type(), output.type());
        assertArrayEquals(TestImages.bytes(input), TestImages.bytes(output));
        input.release();
        mask.release();
        output.release();
    }

    @Test
    void rejectsMaskOfDifferentSize() {
        Mat input = TestImages.pattern(10, 10);
        Mat mask = new Mat(10, 9, CvType.CV_8UC1, new Scalar(255));

        DimensionMismatchException e =
                assertThrows(DimensionMismatchException.class, () -> maskProcessor.process(input, mask));

        assertEquals(10.0, e.getExpected().width);
        assertEquals(9.0, e.getActual().width);
        input.release();
        mask.release();
    }

    @Test
    void rejectsMultiChannelOrMissingMask() {
        Mat input = TestImages.pattern(10, 10);
        Mat colorMask = TestImages.pattern(10, 10);

        assertThrows(InvalidImageException.class, () -> maskProcessor.process(input, colorMask));
        assertThrows(InvalidImageException.class, () -> maskProcessor.process(input, null));
        assertThrows(InvalidImageException.class, () -> maskProcessor.process(null, new Mat()));
        input.release();
        colorMask.release();
    }
}
