package com.project.agro.analysis.DTOs;

import java.util.List;

/**
 * {@code estimatedBiomassKgHa} is a linear interpolation over the biomass index, an order of
 * magnitude indication only.
 */
public record BiomassResult(
        double vegetationCoveragePct,
        int canopyCount,
        long totalCanopyAreaPixels,
        double averageCanopyArea,
        double biomassIndex,
        DensityClass densityClass,
        double estimatedBiomassKgHa,
        List<Region> canopyPatches,
        VigorMetrics vigorMetrics,
        List<String> recommendations,
        long minCanopyAreaParameter
) implements AnalysisResult {

    public BiomassResult {
        canopyPatches = List.copyOf(canopyPatches);
        recommendations = List.copyOf(recommendations);
    }

    @Override
    public AnalysisKind kind() {
        return AnalysisKind.BIOMASS;
    }

    @Override
    public List<Region> regions() {
        return canopyPatches;
    }
}
