package com.project.agro.analysis.imaging;

import com.project.agro.analysis.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Erosion followed by dilation with an elliptical structuring element. Erosion pulls
 * touching blobs apart at their narrowest point; the dilation afterwards restores part of
 * the extent without joining them again.
 */
@Component
public class MorphologicalSeparator {
    private static final Logger log = LoggerFactory.getLogger(MorphologicalSeparator.class);

    public static final int DEFAULT_KERNEL_SIZE = 5;
    public static final int MAX_KERNEL_SIZE = 31;
    public static final int MAX_ITERATIONS = 10;

    public BinaryMask separate(BinaryMask mask, int kernelSize, int erodeIterations, int dilateIterations) {
        if (kernelSize < 1 || kernelSize > MAX_KERNEL_SIZE || kernelSize % 2 == 0) {
            throw new InvalidInputException("Kernel size must be odd and within [1, " + MAX_KERNEL_SIZE + "] (got " + kernelSize + ")");
        }
        if (erodeIterations < 0 || erodeIterations > MAX_ITERATIONS
                || dilateIterations < 0 || dilateIterations > MAX_ITERATIONS) {
            throw new InvalidInputException("Iteration counts must be within [0, " + MAX_ITERATIONS + "] (got erode="
                    + erodeIterations + ", dilate=" + dilateIterations + ")");
        }

        int w = mask.width(), h = mask.height();
        int[][] kernel = ellipse(kernelSize / 2);
        boolean[] cur = mask.copyBits();
        for (int i = 0; i < erodeIterations; i++) cur = erode(cur, w, h, kernel);
        for (int i = 0; i < dilateIterations; i++) cur = dilate(cur, w, h, kernel);

        BinaryMask out = BinaryMask.wrap(w, h, cur);
        log.debug("Morphology k={} erode={} dilate={}: {} -> {} pixels on",
                kernelSize, erodeIterations, dilateIterations, mask.countOn(), out.countOn());
        return out;
    }

    /** Offsets {dx, dy} of a filled disc of the given radius. */
    static int[][] ellipse(int radius) {
        int limit = radius * radius + radius;
        int count = 0;
        for (int dy = -radius; dy <= radius; dy++)
            for (int dx = -radius; dx <= radius; dx++)
                if (dx * dx + dy * dy <= limit) count++;

        int[][] offsets = new int[count][];
        int k = 0;
        for (int dy = -radius; dy <= radius; dy++)
            for (int dx = -radius; dx <= radius; dx++)
                if (dx * dx + dy * dy <= limit) offsets[k++] = new int[]{dx, dy};
        return offsets;
    }

    // Neighbours outside the image never erode a pixel.
    private static boolean[] erode(boolean[] src, int w, int h, int[][] kernel) {
        boolean[] dst = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!src[idx]) continue;

                boolean keep = true;
                for (int k = 0; k < kernel.length && keep; k++) {
                    int xx = x + kernel[k][0];
                    int yy = y + kernel[k][1];
                    if (xx >= 0 && xx < w && yy >= 0 && yy < h && !src[yy * w + xx]) {
                        keep = false;
                    }
                }
                dst[idx] = keep;
            }
        }
        return dst;
    }

    private static boolean[] dilate(boolean[] src, int w, int h, int[][] kernel) {
        boolean[] dst = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                boolean on = src[idx];
                for (int k = 0; k < kernel.length && !on; k++) {
                    int xx = x + kernel[k][0];
                    int yy = y + kernel[k][1];
                    if (xx >= 0 && xx < w && yy >= 0 && yy < h && src[yy * w + xx]) {
                        on = true;
                    }
                }
                dst[idx] = on;
            }
        }
        return dst;
    }
}
