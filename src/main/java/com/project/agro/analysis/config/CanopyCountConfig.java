package com.project.agro.analysis.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Tuning of the canopy counting head.
 *
 * @param explicitThreshold fixed ExG threshold; {@code null} derives it from {@code percentile}
 * @param thresholdMin      lower clamp for the percentile-derived threshold
 * @param thresholdMax      upper clamp for the percentile-derived threshold
 * @param minArea           smallest canopy kept, in original-resolution pixels
 * @param maxArea           largest canopy kept, in original-resolution pixels
 * @param maxListedRegions  cap on the canopies listed in the result; counts cover all of them
 * @param maxDimension      longer image side above which the buffer is downscaled first
 */
public record CanopyCountConfig(
        @DecimalMin("0.0") @DecimalMax("1.0") Double explicitThreshold,
        @DecimalMin("0.0") @DecimalMax("100.0") double percentile,
        @DecimalMin("0.0") @DecimalMax("1.0") double thresholdMin,
        @DecimalMin("0.0") @DecimalMax("1.0") double thresholdMax,
        @Min(1) @Max(31) int kernelSize,
        @Min(0) @Max(10) int erodeIterations,
        @Min(0) @Max(10) int dilateIterations,
        @Min(value = 10, message = "minArea must be at least 10 pixels")
        @Max(value = 10000, message = "minArea must not exceed 10000 pixels") long minArea,
        @Min(value = 100, message = "maxArea must be at least 100 pixels")
        @Max(value = 1000000, message = "maxArea must not exceed 1000000 pixels") long maxArea,
        @Min(1) @Max(10000) int maxListedRegions,
        @Min(100) @Max(10000) int maxDimension,
        @Min(1) int minVegetationPixels
) {
    public static CanopyCountConfig defaults() {
        return new CanopyCountConfig(null, 70.0, 0.5, 0.7, 5, 2, 1, 50, 15000, 100, 2000, 100);
    }

    @AssertTrue(message = "maxArea must be greater than minArea")
    public boolean isAreaRangeValid() {
        return maxArea > minArea;
    }

    @AssertTrue(message = "kernelSize must be odd")
    public boolean isKernelSizeOdd() {
        return kernelSize % 2 == 1;
    }

    @AssertTrue(message = "thresholdMin must not exceed thresholdMax")
    public boolean isThresholdRangeValid() {
        return thresholdMin <= thresholdMax;
    }

    public CanopyCountConfig withAreaBounds(long newMinArea, long newMaxArea) {
        return new CanopyCountConfig(explicitThreshold, percentile, thresholdMin, thresholdMax, kernelSize,
                erodeIterations, dilateIterations, newMinArea, newMaxArea, maxListedRegions, maxDimension, minVegetationPixels);
    }

    public CanopyCountConfig withExplicitThreshold(Double threshold) {
        return new CanopyCountConfig(threshold, percentile, thresholdMin, thresholdMax, kernelSize,
                erodeIterations, dilateIterations, minArea, maxArea, maxListedRegions, maxDimension, minVegetationPixels);
    }

    public CanopyCountConfig withMorphology(int newKernelSize, int newErodeIterations, int newDilateIterations) {
        return new CanopyCountConfig(explicitThreshold, percentile, thresholdMin, thresholdMax, newKernelSize,
                newErodeIterations, newDilateIterations, minArea, maxArea, maxListedRegions, maxDimension, minVegetationPixels);
    }

    public CanopyCountConfig withMaxListedRegions(int cap) {
        return new CanopyCountConfig(explicitThreshold, percentile, thresholdMin, thresholdMax, kernelSize,
                erodeIterations, dilateIterations, minArea, maxArea, cap, maxDimension, minVegetationPixels);
    }

    public CanopyCountConfig withMaxDimension(int newMaxDimension) {
        return new CanopyCountConfig(explicitThreshold, percentile, thresholdMin, thresholdMax, kernelSize,
                erodeIterations, dilateIterations, minArea, maxArea, maxListedRegions, newMaxDimension, minVegetationPixels);
    }
}
