package com.project.agro.analysis.imaging;

import com.project.agro.analysis.exceptions.InvalidInputException;

/** Inclusive range a percentile-derived threshold is clamped into. */
public record ThresholdRange(double min, double max) {

    public static final ThresholdRange UNIT = new ThresholdRange(0.0, 1.0);

    public ThresholdRange {
        if (!(min >= 0.0 && max <= 1.0 && min <= max)) {
            throw new InvalidInputException("Threshold range must satisfy 0 <= min <= max <= 1 (got [" + min + ", " + max + "])");
        }
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }
}
