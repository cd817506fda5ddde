package com.project.agro.analysis.DTOs;

public record RoiMetadata(
        long areaPixels,
        double perimeterPixels,
        double xMin,
        double yMin,
        double xMax,
        double yMax,
        double coveragePct,
        int imageWidth,
        int imageHeight,
        int numVertices
) {}
