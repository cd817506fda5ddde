package com.project.agro.analysis.imaging;

import java.awt.Color;

/**
 * Hue in degrees [0,360), saturation and value on a 0-255 scale, per pixel.
 */
public final class HsvImage {
    private final int width;
    private final int height;
    private final float[] hue;
    private final float[] saturation;
    private final float[] value;

    private HsvImage(int width, int height, float[] hue, float[] saturation, float[] value) {
        this.width = width;
        this.height = height;
        this.hue = hue;
        this.saturation = saturation;
        this.value = value;
    }

    public static HsvImage of(PixelBuffer buffer) {
        int n = buffer.pixelCount();
        float[] h = new float[n], s = new float[n], v = new float[n];
        float[] hsb = new float[3];
        for (int i = 0; i < n; i++) {
            Color.RGBtoHSB(buffer.red(i), buffer.green(i), buffer.blue(i), hsb);
            h[i] = hsb[0] * 360f;
            s[i] = hsb[1] * 255f;
            v[i] = hsb[2] * 255f;
        }
        return new HsvImage(buffer.width(), buffer.height(), h, s, v);
    }

    public int width() { return width; }

    public int height() { return height; }

    public float hue(int index) { return hue[index]; }

    public float saturation(int index) { return saturation[index]; }

    public float value(int index) { return value[index]; }
}
