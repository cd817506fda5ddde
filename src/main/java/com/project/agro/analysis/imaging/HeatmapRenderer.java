package com.project.agro.analysis.imaging;

import org.springframework.stereotype.Component;

/**
 * Renders an index field in [0,1] as a false-color RGB buffer of the same size.
 */
@Component
public class HeatmapRenderer {

    public PixelBuffer render(IndexField field, Colormap colormap) {
        int n = field.size();
        byte[] rgb = new byte[n * PixelBuffer.CHANNELS];
        for (int i = 0; i < n; i++) {
            double v = Math.max(0.0, Math.min(1.0, field.get(i)));
            int[] c = colormap.map((int) (v * 255));
            rgb[3 * i] = (byte) PixelBuffer.clamp(c[0]);
            rgb[3 * i + 1] = (byte) PixelBuffer.clamp(c[1]);
            rgb[3 * i + 2] = (byte) PixelBuffer.clamp(c[2]);
        }
        return PixelBuffer.of(field.width(), field.height(), PixelBuffer.CHANNELS, rgb);
    }
}
