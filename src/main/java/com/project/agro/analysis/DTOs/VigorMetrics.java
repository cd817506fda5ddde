package com.project.agro.analysis.DTOs;

/**
 * Greenness and texture inside the vegetation mask.
 *
 * @param meanGreenIntensity mean green channel, 0-255
 * @param meanExg            mean normalized Excess Green
 * @param textureVariance    population variance of 8-bit grayscale
 */
public record VigorMetrics(double meanGreenIntensity, double meanExg, double textureVariance) {

    public static final VigorMetrics ZERO = new VigorMetrics(0.0, 0.0, 0.0);
}
