package com.project.agro.analysis.DTOs;

import java.util.List;

/**
 * Common view over the head results. Results are plain copies; none refers back to the
 * buffer they were computed from.
 */
public interface AnalysisResult {

    AnalysisKind kind();

    List<Region> regions();

    List<String> recommendations();
}
