package com.project.agro.analysis.imaging;

import com.project.agro.analysis.exceptions.InvalidInputException;

import java.util.Arrays;

/**
 * Immutable per-pixel vegetation/background map. Set operations return new masks.
 */
public final class BinaryMask {
    private final int width;
    private final int height;
    private final boolean[] bits;

    private BinaryMask(int width, int height, boolean[] bits) {
        this.width = width;
        this.height = height;
        this.bits = bits;
    }

    public static BinaryMask of(int width, int height, boolean[] bits) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Mask dimensions must be positive (got " + width + "x" + height + ")");
        }
        if (bits == null || bits.length != width * height) {
            throw new InvalidInputException("Mask bits do not match " + width + "x" + height);
        }
        return new BinaryMask(width, height, bits.clone());
    }

    public static BinaryMask empty(int width, int height) {
        return of(width, height, new boolean[width * height]);
    }

    /** Takes ownership of {@code bits}. */
    static BinaryMask wrap(int width, int height, boolean[] bits) {
        return new BinaryMask(width, height, bits);
    }

    public int width() { return width; }

    public int height() { return height; }

    public int size() { return bits.length; }

    public boolean get(int index) { return bits[index]; }

    public boolean get(int x, int y) { return bits[y * width + x]; }

    public int countOn() {
        int c = 0;
        for (boolean b : bits) if (b) c++;
        return c;
    }

    public BinaryMask and(BinaryMask other) {
        other.requireSameSize(width, height);
        boolean[] out = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) out[i] = bits[i] && other.bits[i];
        return new BinaryMask(width, height, out);
    }

    /** Pixels set here and not set in {@code other}. */
    public BinaryMask andNot(BinaryMask other) {
        other.requireSameSize(width, height);
        boolean[] out = new boolean[bits.length];
        for (int i = 0; i < bits.length; i++) out[i] = bits[i] && !other.bits[i];
        return new BinaryMask(width, height, out);
    }

    boolean[] copyBits() {
        return bits.clone();
    }

    void requireSameSize(int w, int h) {
        if (w != width || h != height) {
            throw new InvalidInputException("Mask is " + width + "x" + height + " but " + w + "x" + h + " was expected");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryMask)) return false;
        BinaryMask other = (BinaryMask) o;
        return width == other.width && height == other.height && Arrays.equals(bits, other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        return "BinaryMask[" + width + "x" + height + ", on=" + countOn() + "]";
    }
}
