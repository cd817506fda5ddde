package com.project.agro.analysis.imaging;

import com.project.agro.analysis.exceptions.InvalidInputException;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable width x height x 3 view of 8-bit RGB samples, stored interleaved row by row.
 * The engine only reads it; every transformation returns a new buffer.
 */
public final class PixelBuffer {
    public static final int CHANNELS = 3;

    private final int width;
    private final int height;
    private final byte[] rgb;

    private PixelBuffer(int width, int height, byte[] rgb) {
        this.width = width;
        this.height = height;
        this.rgb = rgb;
    }

    /**
     * Copies {@code samples} (interleaved R,G,B per pixel) into a new buffer.
     *
     * @throws InvalidInputException on non-positive dimensions, a channel count other
     *                               than 3 or a sample array of the wrong length
     */
    public static PixelBuffer of(int width, int height, int channels, byte[] samples) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Buffer dimensions must be positive (got " + width + "x" + height + ")");
        }
        if (channels != CHANNELS) {
            throw new InvalidInputException("Expected " + CHANNELS + " channels, got " + channels);
        }
        if (samples == null || samples.length != (long) width * height * CHANNELS) {
            throw new InvalidInputException("Sample array length does not match " + width + "x" + height + "x" + CHANNELS);
        }
        return new PixelBuffer(width, height, samples.clone());
    }

    public static PixelBuffer filled(int width, int height, int r, int g, int b) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Buffer dimensions must be positive (got " + width + "x" + height + ")");
        }
        byte[] rgb = new byte[width * height * CHANNELS];
        for (int i = 0; i < width * height; i++) {
            rgb[3 * i] = (byte) clamp(r);
            rgb[3 * i + 1] = (byte) clamp(g);
            rgb[3 * i + 2] = (byte) clamp(b);
        }
        return new PixelBuffer(width, height, rgb);
    }

    /** Reads the RGB samples of a decoded image; alpha is ignored. */
    public static PixelBuffer fromImage(BufferedImage image) {
        if (image == null) {
            throw new InvalidInputException("Image is missing");
        }
        int w = image.getWidth(), h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        return fromArgb(w, h, argb);
    }

    static PixelBuffer fromArgb(int w, int h, int[] argb) {
        byte[] rgb = new byte[w * h * CHANNELS];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            rgb[3 * i] = (byte) ((p >> 16) & 0xFF);
            rgb[3 * i + 1] = (byte) ((p >> 8) & 0xFF);
            rgb[3 * i + 2] = (byte) (p & 0xFF);
        }
        return new PixelBuffer(w, h, rgb);
    }

    public BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int n = width * height;
        int[] argb = new int[n];
        for (int i = 0; i < n; i++) {
            argb[i] = (0xFF << 24) | (red(i) << 16) | (green(i) << 8) | blue(i);
        }
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    /**
     * Bilinear downscale so that the longer side is at most {@code maxDimension},
     * preserving aspect ratio. Returns this buffer when it already fits.
     */
    public Scaled downscaledTo(int maxDimension) {
        int longer = Math.max(width, height);
        if (longer <= maxDimension) {
            return new Scaled(this, 1.0, width, height);
        }
        double scale = (double) maxDimension / longer;
        int newW = Math.max(1, (int) (width * scale));
        int newH = Math.max(1, (int) (height * scale));

        BufferedImage scaled = new BufferedImage(newW, newH, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        graphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        graphics.drawImage(toImage(), 0, 0, newW, newH, null);
        graphics.dispose();

        return new Scaled(fromImage(scaled), scale, width, height);
    }

    /** Returns a copy where every pixel with {@code keep[i] == false} is black. */
    public PixelBuffer masked(BinaryMask keep) {
        keep.requireSameSize(width, height);
        byte[] out = rgb.clone();
        for (int i = 0; i < width * height; i++) {
            if (!keep.get(i)) {
                out[3 * i] = 0;
                out[3 * i + 1] = 0;
                out[3 * i + 2] = 0;
            }
        }
        return new PixelBuffer(width, height, out);
    }

    public int width() { return width; }

    public int height() { return height; }

    public int pixelCount() { return width * height; }

    public int red(int index) { return rgb[3 * index] & 0xFF; }

    public int green(int index) { return rgb[3 * index + 1] & 0xFF; }

    public int blue(int index) { return rgb[3 * index + 2] & 0xFF; }

    public int red(int x, int y) { return red(y * width + x); }

    public int green(int x, int y) { return green(y * width + x); }

    public int blue(int x, int y) { return blue(y * width + x); }

    /** Rounded 8-bit luma (0.299R + 0.587G + 0.114B). */
    public int[] toGray() {
        int n = width * height;
        int[] gray = new int[n];
        for (int i = 0; i < n; i++) {
            gray[i] = (int) Math.round(0.299 * red(i) + 0.587 * green(i) + 0.114 * blue(i));
        }
        return gray;
    }

    static int clamp(int v) {
        return (v < 0) ? 0 : Math.min(255, v);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelBuffer)) return false;
        PixelBuffer other = (PixelBuffer) o;
        return width == other.width && height == other.height && Arrays.equals(rgb, other.rgb);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgb);
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + "]";
    }

    /**
     * A buffer prepared for analysis together with the factor that maps its coordinates
     * back to the original resolution ({@code analyzed = original * scale}).
     */
    public record Scaled(PixelBuffer buffer, double scale, int originalWidth, int originalHeight) {
        public long originalPixelCount() {
            return (long) originalWidth * originalHeight;
        }

        /** Original pixels represented by one analyzed pixel. */
        public double areaFactor() {
            return (double) originalPixelCount() / buffer.pixelCount();
        }
    }
}
