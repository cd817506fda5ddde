package com.project.agro.analysis.DTOs;

public enum RegionKind {
    CANOPY("canopy"),
    CHLOROSIS("chlorosis"),
    NECROSIS("necrosis"),
    TEXTURE_ANOMALY("anomaly");

    private final String code;

    RegionKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
