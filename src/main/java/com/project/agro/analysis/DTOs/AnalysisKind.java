package com.project.agro.analysis.DTOs;

/** Selects an analysis head at the service boundary. */
public enum AnalysisKind {
    CANOPY_COUNT,
    SYMPTOMS,
    BIOMASS
}
