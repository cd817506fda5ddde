package com.project.agro.analysis.imaging;

import com.project.agro.analysis.exceptions.InvalidInputException;

import java.util.Arrays;

/**
 * Single-channel per-pixel float map with the dimensions of the buffer it was computed from.
 */
public final class IndexField {
    private final int width;
    private final int height;
    private final float[] values;

    public IndexField(int width, int height, float[] values) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Field dimensions must be positive (got " + width + "x" + height + ")");
        }
        if (values == null || values.length != width * height) {
            throw new InvalidInputException("Field values do not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.values = values.clone();
    }

    /** Takes ownership of {@code values}; callers in this package never touch the array afterwards. */
    static IndexField wrap(int width, int height, float[] values) {
        return new IndexField(width, height, values, true);
    }

    private IndexField(int width, int height, float[] values, boolean owned) {
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public int width() { return width; }

    public int height() { return height; }

    public int size() { return values.length; }

    public float get(int index) { return values[index]; }

    public float get(int x, int y) { return values[y * width + x]; }

    public float min() {
        float m = Float.POSITIVE_INFINITY;
        for (float v : values) m = Math.min(m, v);
        return m;
    }

    public float max() {
        float m = Float.NEGATIVE_INFINITY;
        for (float v : values) m = Math.max(m, v);
        return m;
    }

    public double mean() {
        double sum = 0;
        for (float v : values) sum += v;
        return sum / values.length;
    }

    /** Mean over the pixels set in {@code mask}; 0 when the mask is empty. */
    public double mean(BinaryMask mask) {
        mask.requireSameSize(width, height);
        double sum = 0;
        int count = 0;
        for (int i = 0; i < values.length; i++) {
            if (mask.get(i)) {
                sum += values[i];
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }

    /**
     * Percentile with linear interpolation between closest ranks, {@code p} in [0,100].
     * A constant field returns that constant.
     */
    public double percentile(double p) {
        float[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = (int) Math.ceil(pos);
        if (lo == hi) {
            return sorted[lo];
        }
        double frac = pos - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    void requireSameSize(int w, int h) {
        if (w != width || h != height) {
            throw new InvalidInputException("Field is " + width + "x" + height + " but " + w + "x" + h + " was expected");
        }
    }

    @Override
    public String toString() {
        return "IndexField[" + width + "x" + height + "]";
    }
}
