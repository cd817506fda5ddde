package com.project.agro.analysis.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Tuning of the symptom classifier. Hue is in degrees on a 0-360 scale, saturation and value
 * on 0-255. The color bounds are product calibration, not agronomic constants.
 */
public record SymptomConfig(
        @DecimalMin("0.0") @DecimalMax("100.0") double vegetationPercentile,
        @DecimalMin("0.0") @DecimalMax("1.0") double vegetationThresholdMin,
        @DecimalMin("0.0") @DecimalMax("1.0") double vegetationThresholdMax,
        @DecimalMin("0.0") @DecimalMax("360.0") double chlorosisHueMin,
        @DecimalMin("0.0") @DecimalMax("360.0") double chlorosisHueMax,
        @DecimalMin("0.0") @DecimalMax("255.0") double chlorosisSaturationMin,
        @DecimalMin("0.0") @DecimalMax("360.0") double necrosisHueMin,
        @DecimalMin("0.0") @DecimalMax("360.0") double necrosisHueMax,
        @DecimalMin("0.0") @DecimalMax("255.0") double necrosisSaturationMin,
        @DecimalMin("0.0") @DecimalMax("255.0") double necrosisValueMax,
        @Min(3) @Max(201) int textureWindow,
        @DecimalMin(value = "0.5", message = "anomalyThreshold must be at least 0.5")
        @DecimalMax(value = "5.0", message = "anomalyThreshold must not exceed 5.0") double anomalyThreshold,
        @Min(value = 10, message = "minRegionArea must be at least 10 pixels")
        @Max(value = 10000, message = "minRegionArea must not exceed 10000 pixels") long minRegionArea,
        @Min(1) @Max(1000) int maxRegionsPerCategory,
        @Min(1) @Max(1000) int maxRegions,
        @Min(100) @Max(10000) int maxDimension,
        @Min(1) int minVegetationPixels
) {
    public static SymptomConfig defaults() {
        return new SymptomConfig(70.0, 0.05, 1.0,
                20.0, 40.0, 50.0,
                10.0, 25.0, 30.0, 150.0,
                51, 2.0, 100, 7, 20, 1500, 100);
    }

    @AssertTrue(message = "textureWindow must be odd")
    public boolean isTextureWindowOdd() {
        return textureWindow % 2 == 1;
    }

    @AssertTrue(message = "hue ranges must have min <= max")
    public boolean isHueRangesValid() {
        return chlorosisHueMin <= chlorosisHueMax && necrosisHueMin <= necrosisHueMax;
    }

    @AssertTrue(message = "vegetationThresholdMin must not exceed vegetationThresholdMax")
    public boolean isVegetationThresholdRangeValid() {
        return vegetationThresholdMin <= vegetationThresholdMax;
    }

    public SymptomConfig withAnomalyThreshold(double threshold) {
        return new SymptomConfig(vegetationPercentile, vegetationThresholdMin, vegetationThresholdMax,
                chlorosisHueMin, chlorosisHueMax, chlorosisSaturationMin,
                necrosisHueMin, necrosisHueMax, necrosisSaturationMin, necrosisValueMax,
                textureWindow, threshold, minRegionArea, maxRegionsPerCategory, maxRegions, maxDimension, minVegetationPixels);
    }

    public SymptomConfig withMinRegionArea(long area) {
        return new SymptomConfig(vegetationPercentile, vegetationThresholdMin, vegetationThresholdMax,
                chlorosisHueMin, chlorosisHueMax, chlorosisSaturationMin,
                necrosisHueMin, necrosisHueMax, necrosisSaturationMin, necrosisValueMax,
                textureWindow, anomalyThreshold, area, maxRegionsPerCategory, maxRegions, maxDimension, minVegetationPixels);
    }

    public SymptomConfig withTextureWindow(int window) {
        return new SymptomConfig(vegetationPercentile, vegetationThresholdMin, vegetationThresholdMax,
                chlorosisHueMin, chlorosisHueMax, chlorosisSaturationMin,
                necrosisHueMin, necrosisHueMax, necrosisSaturationMin, necrosisValueMax,
                window, anomalyThreshold, minRegionArea, maxRegionsPerCategory, maxRegions, maxDimension, minVegetationPixels);
    }

    public SymptomConfig withMaxDimension(int newMaxDimension) {
        return new SymptomConfig(vegetationPercentile, vegetationThresholdMin, vegetationThresholdMax,
                chlorosisHueMin, chlorosisHueMax, chlorosisSaturationMin,
                necrosisHueMin, necrosisHueMax, necrosisSaturationMin, necrosisValueMax,
                textureWindow, anomalyThreshold, minRegionArea, maxRegionsPerCategory, maxRegions, newMaxDimension, minVegetationPixels);
    }
}
