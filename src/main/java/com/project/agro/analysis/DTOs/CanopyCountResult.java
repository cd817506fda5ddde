package com.project.agro.analysis.DTOs;

import java.util.List;

public record CanopyCountResult(
        int totalCanopies,
        long totalCanopyAreaPixels,
        double coveragePercentage,
        double averageCanopyArea,
        long minCanopyArea,
        long maxCanopyArea,
        List<Region> canopies,      // largest first, capped; counts above cover every canopy
        int imageWidth,
        int imageHeight,
        double thresholdUsed,
        long minAreaParameter,
        long maxAreaParameter,
        List<String> recommendations
) implements AnalysisResult {

    public CanopyCountResult {
        canopies = List.copyOf(canopies);
        recommendations = List.copyOf(recommendations);
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.CANOPY_COUNT;
    }

    @Override
    public List<Region> regions() {
        return canopies;
    }
}
