package com.project.agro.analysis.DTOs;

/** Infection severity by infection rate: below 5, 15 and 30 percent. */
public enum Severity {
    HEALTHY("saudavel"),
    MILD("leve"),
    MODERATE("moderado"),
    SEVERE("severo");

    private final String code;

    Severity(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Severity fromInfectionRate(double infectionRate) {
        if (infectionRate < 5) return HEALTHY;
        if (infectionRate < 15) return MILD;
        if (infectionRate < 30) return MODERATE;
        return SEVERE;
    }
}
