package com.project.agro.analysis.imaging;

import com.project.agro.analysis.exceptions.InvalidInputException;

import java.util.Locale;

/**
 * Palettes for index heatmaps. Each maps {@code e = (int) (index * 255)} linearly per channel;
 * channel values are clamped to [0,255].
 */
public enum Colormap {
    /** Brown soil to green canopy: R = 139 - e/2, G = e, B = 69 - 0.3e. */
    GREEN {
        @Override
        int[] map(int e) {
            return new int[]{139 - (int) (e * 0.5), e, 69 - (int) (e * 0.3)};
        }
    },
    /** Red to green: R = 255 - e, G = e, B = 0. */
    JET {
        @Override
        int[] map(int e) {
            return new int[]{255 - e, e, 0};
        }
    },
    /** Viridis-like: R = 0.3e, G = e, B = 255 - e/2. */
    VIRIDIS {
        @Override
        int[] map(int e) {
            return new int[]{(int) (e * 0.3), e, (int) (255 - e * 0.5)};
        }
    };

    abstract int[] map(int e);

    public static Colormap fromName(String name) {
        if (name == null) {
            throw new InvalidInputException("Colormap name is missing");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "green":
                return GREEN;
            case "jet":
                return JET;
            case "viridis":
            case "viridis-like":
                return VIRIDIS;
            default:
                throw new InvalidInputException("Unknown colormap: " + name + " (expected green, jet or viridis)");
        }
    }
}
