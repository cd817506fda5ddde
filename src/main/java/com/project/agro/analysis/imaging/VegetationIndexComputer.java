package com.project.agro.analysis.imaging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Greenness indices computed from plain RGB, for imagery without a near-infrared band.
 */
@Component
public class VegetationIndexComputer {
    private static final Logger log = LoggerFactory.getLogger(VegetationIndexComputer.class);

    static final double EPSILON = 1e-6;

    /**
     * Excess Green on chromatic coordinates, {@code 2g - r - b} with {@code c = C / (R + G + B)},
     * min-max normalized to [0,1] over the image.
     * <p>
     * When the raw field has no usable spread (a uniform image) min-max normalization carries
     * no information, so the raw value clamped to [0,1] is kept instead: a uniform soil or gray
     * image stays near 0 and a uniform canopy stays near 1.
     */
    public IndexField excessGreen(PixelBuffer buffer) {
        int n = buffer.pixelCount();
        float[] exg = new float[n];
        float min = Float.POSITIVE_INFINITY, max = Float.NEGATIVE_INFINITY;

        for (int i = 0; i < n; i++) {
            float r = buffer.red(i) / 255f, g = buffer.green(i) / 255f, b = buffer.blue(i) / 255f;
            float total = r + g + b;
            if (total == 0f) total = 1f;
            float v = 2f * (g / total) - (r / total) - (b / total);
            exg[i] = v;
            if (v < min) min = v;
            if (v > max) max = v;
        }

        double range = (double) max - min;
        if (range < EPSILON) {
            log.debug("ExG field has no spread (value {}), keeping clamped raw values", min);
            for (int i = 0; i < n; i++) {
                exg[i] = Math.max(0f, Math.min(1f, exg[i]));
            }
        } else {
            double denom = range + EPSILON;
            for (int i = 0; i < n; i++) {
                exg[i] = (float) ((exg[i] - min) / denom);
            }
        }
        return IndexField.wrap(buffer.width(), buffer.height(), exg);
    }

    /** Green Leaf Index {@code (2G - R - B) / (2G + R + B)} on raw channels, in [-1,1]. */
    public IndexField greenLeaf(PixelBuffer buffer) {
        int n = buffer.pixelCount();
        float[] gli = new float[n];
        for (int i = 0; i < n; i++) {
            int r = buffer.red(i), g = buffer.green(i), b = buffer.blue(i);
            int denominator = 2 * g + r + b;
            if (denominator == 0) denominator = 1;
            gli[i] = (float) (2 * g - r - b) / denominator;
        }
        return IndexField.wrap(buffer.width(), buffer.height(), gli);
    }
}
