package com.project.agro.analysis.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Tuning of the biomass estimator. The kg/ha endpoints are a heuristic linear scale, not a
 * calibrated allometric model.
 */
public record BiomassConfig(
        @DecimalMin("0.0") @DecimalMax("100.0") double percentile,
        @DecimalMin("0.0") @DecimalMax("1.0") double thresholdMin,
        @DecimalMin("0.0") @DecimalMax("1.0") double thresholdMax,
        @Min(1) @Max(31) int kernelSize,
        @Min(0) @Max(10) int erodeIterations,
        @Min(0) @Max(10) int dilateIterations,
        @Min(value = 10, message = "minCanopyArea must be at least 10 pixels")
        @Max(value = 10000, message = "minCanopyArea must not exceed 10000 pixels") long minCanopyArea,
        @Min(1) @Max(10000) int maxListedPatches,
        @DecimalMin("0.0") @DecimalMax("1.0") double coverageWeight,
        @DecimalMin("0.0") @DecimalMax("1.0") double densityWeight,
        @DecimalMin("0.0") @DecimalMax("1.0") double vigorWeight,
        @DecimalMin("0.0") @DecimalMax("1.0") double textureWeight,
        @DecimalMin("1.0") double textureVarianceCap,
        @DecimalMin("0.0") double minBiomassKgHa,
        @DecimalMin("0.0") double maxBiomassKgHa,
        @Min(100) @Max(10000) int maxDimension,
        @Min(1) int minVegetationPixels
) {
    public static BiomassConfig defaults() {
        return new BiomassConfig(70.0, 0.05, 1.0, 5, 2, 1, 50, 20,
                0.40, 0.30, 0.15, 0.15, 2000.0,
                2000.0, 400000.0, 1500, 100);
    }

    @AssertTrue(message = "kernelSize must be odd")
    public boolean isKernelSizeOdd() {
        return kernelSize % 2 == 1;
    }

    @AssertTrue(message = "thresholdMin must not exceed thresholdMax")
    public boolean isThresholdRangeValid() {
        return thresholdMin <= thresholdMax;
    }

    @AssertTrue(message = "minBiomassKgHa must not exceed maxBiomassKgHa")
    public boolean isBiomassScaleValid() {
        return minBiomassKgHa <= maxBiomassKgHa;
    }

    public BiomassConfig withMinCanopyArea(long area) {
        return new BiomassConfig(percentile, thresholdMin, thresholdMax, kernelSize, erodeIterations, dilateIterations,
                area, maxListedPatches, coverageWeight, densityWeight, vigorWeight, textureWeight, textureVarianceCap,
                minBiomassKgHa, maxBiomassKgHa, maxDimension, minVegetationPixels);
    }

    public BiomassConfig withMaxDimension(int newMaxDimension) {
        return new BiomassConfig(percentile, thresholdMin, thresholdMax, kernelSize, erodeIterations, dilateIterations,
                minCanopyArea, maxListedPatches, coverageWeight, densityWeight, vigorWeight, textureWeight, textureVarianceCap,
                minBiomassKgHa, maxBiomassKgHa, newMaxDimension, minVegetationPixels);
    }
}
