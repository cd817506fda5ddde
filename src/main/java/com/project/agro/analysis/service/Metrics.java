package com.project.agro.analysis.service;

import com.project.agro.analysis.exceptions.ComputationFailureException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Rounding and sanity guards shared by the analysis heads. */
final class Metrics {

    private Metrics() {}

    static double round(double value, int decimals) {
        requireFinite("value", value);
        return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }

    static double clampPercent(double value) {
        return Math.max(0.0, Math.min(100.0, value));
    }

    static double percent(long part, long whole) {
        return whole <= 0 ? 0.0 : 100.0 * part / whole;
    }

    static double requireFinite(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new ComputationFailureException("Computed " + name + " is not a finite number: " + value);
        }
        return value;
    }
}
