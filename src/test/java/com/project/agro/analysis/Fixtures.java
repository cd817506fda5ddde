package com.project.agro.analysis;

import com.project.agro.analysis.imaging.AdaptiveThresholder;
import com.project.agro.analysis.imaging.BinaryMask;
import com.project.agro.analysis.imaging.MorphologicalSeparator;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.imaging.RegionExtractor;
import com.project.agro.analysis.imaging.VegetationIndexComputer;
import com.project.agro.analysis.service.BiomassEstimator;
import com.project.agro.analysis.service.CanopyCounter;
import com.project.agro.analysis.service.ParameterValidator;
import com.project.agro.analysis.service.SymptomClassifier;
import jakarta.validation.Validation;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/** Synthetic aerial scenes and engine wiring shared by the unit tests. */
final class Fixtures {
    static final Color SOIL = new Color(150, 60, 60);
    static final Color LEAF = new Color(30, 120, 30);
    static final Color YELLOWING = new Color(200, 140, 40);
    static final Color BROWNING = new Color(125, 50, 0);

    private Fixtures() {}

    static ParameterValidator validator() {
        return new ParameterValidator(Validation.buildDefaultValidatorFactory().getValidator());
    }

    static CanopyCounter canopyCounter() {
        return new CanopyCounter(new VegetationIndexComputer(), new AdaptiveThresholder(),
                new MorphologicalSeparator(), new RegionExtractor(), validator());
    }

    static SymptomClassifier symptomClassifier() {
        return new SymptomClassifier(new VegetationIndexComputer(), new AdaptiveThresholder(),
                new RegionExtractor(), validator());
    }

    static BiomassEstimator biomassEstimator() {
        return new BiomassEstimator(new VegetationIndexComputer(), new AdaptiveThresholder(),
                new MorphologicalSeparator(), new RegionExtractor(), validator());
    }

    static BufferedImage canvas(int w, int h, Color background) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        g.setColor(background);
        g.fillRect(0, 0, w, h);
        g.dispose();
        return img;
    }

    /** Soil field with a grid of green crowns of the given radius, centers every {@code spacing} px. */
    static PixelBuffer orchard(int w, int h, int radius, int spacing) {
        BufferedImage img = canvas(w, h, SOIL);
        Graphics2D g = img.createGraphics();
        g.setColor(LEAF);
        for (int cy = spacing / 2; cy < h; cy += spacing) {
            for (int cx = spacing / 2; cx < w; cx += spacing) {
                g.fillOval(cx - radius, cy - radius, 2 * radius, 2 * radius);
            }
        }
        g.dispose();
        return PixelBuffer.fromImage(img);
    }

    static PixelBuffer rectangles(int w, int h, Color background, Object... colorAndRects) {
        BufferedImage img = canvas(w, h, background);
        Graphics2D g = img.createGraphics();
        for (int i = 0; i < colorAndRects.length; i += 2) {
            int[] r = (int[]) colorAndRects[i + 1];
            g.setColor((Color) colorAndRects[i]);
            g.fillRect(r[0], r[1], r[2], r[3]);
        }
        g.dispose();
        return PixelBuffer.fromImage(img);
    }

    static BinaryMask squares(int w, int h, int[]... rects) {
        boolean[] bits = new boolean[w * h];
        for (int[] r : rects) {
            for (int y = r[1]; y < r[1] + r[3]; y++)
                for (int x = r[0]; x < r[0] + r[2]; x++)
                    bits[y * w + x] = true;
        }
        return BinaryMask.of(w, h, bits);
    }
}
