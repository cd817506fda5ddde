package com.project.agro.analysis.DTOs;

public record CoverageResult(
        double vegetationPercentage,
        double nonVegetationPercentage,
        long totalPixels,
        long vegetationPixels,
        double thresholdUsed
) {}
