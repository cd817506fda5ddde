package com.project.agro.analysis.DTOs;

/** Biomass density bands by biomass index: below 25, 50 and 75. */
public enum DensityClass {
    SPARSE("esparsa"),
    MODERATE("moderada"),
    DENSE("densa"),
    VERY_DENSE("muito_densa");

    private final String code;

    DensityClass(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static DensityClass fromBiomassIndex(double biomassIndex) {
        if (biomassIndex < 25) return SPARSE;
        if (biomassIndex < 50) return MODERATE;
        if (biomassIndex < 75) return DENSE;
        return VERY_DENSE;
    }
}
