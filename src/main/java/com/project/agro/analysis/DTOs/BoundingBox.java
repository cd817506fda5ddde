package com.project.agro.analysis.DTOs;

/** Inclusive pixel bounds. */
public record BoundingBox(int xMin, int yMin, int xMax, int yMax) {

    public int width() {
        return xMax - xMin + 1;
    }

    public int height() {
        return yMax - yMin + 1;
    }

    public boolean containedIn(int imageWidth, int imageHeight) {
        return xMin >= 0 && yMin >= 0 && xMax < imageWidth && yMax < imageHeight
                && xMin <= xMax && yMin <= yMax;
    }
}
