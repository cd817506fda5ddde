package com.project.agro.analysis.DTOs;

/**
 * Share of pixels per ExG band (healthy above 0.5, moderate above 0.25, stressed above 0.1)
 * and their weighted health index, 0-100.
 */
public record VegetationHealthResult(
        double healthIndex,
        double healthyPercentage,
        double moderatePercentage,
        double stressedPercentage,
        double nonVegetationPercentage,
        double vegetationTotalPercentage,
        double meanExg,
        double meanGli
) {}
