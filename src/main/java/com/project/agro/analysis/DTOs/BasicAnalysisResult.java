package com.project.agro.analysis.DTOs;

public record BasicAnalysisResult(
        CoverageResult coverage,
        VegetationHealthResult health,
        ColorStatistics colors,
        ColorHistogram histogram,
        int width,
        int height
) {}
