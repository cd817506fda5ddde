package com.project.agro.analysis.DTOs;

import java.util.List;

public record SymptomResult(
        long totalVegetationPixels,
        double healthyPercentage,
        double chlorosisPercentage,
        double necrosisPercentage,
        double anomalyPercentage,
        double infectionRate,
        Severity severity,
        List<Region> affectedRegions,
        List<String> recommendations,
        Parameters parameters
) implements AnalysisResult {

    public SymptomResult {
        affectedRegions = List.copyOf(affectedRegions);
        recommendations = List.copyOf(recommendations);
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.SYMPTOMS;
    }

    @Override
    public List<Region> regions() {
        return affectedRegions;
    }

    /** Effective classification bounds, hue in degrees. */
    public record Parameters(
            double chlorosisHueMin,
            double chlorosisHueMax,
            double necrosisHueMin,
            double necrosisHueMax,
            double anomalyThreshold,
            long minRegionArea
    ) {}
}
