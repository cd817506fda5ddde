package com.project.agro.analysis.imaging;

import com.project.agro.analysis.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Binarizes an index field with either a caller-supplied threshold or a clamped percentile.
 */
@Component
public class AdaptiveThresholder {
    private static final Logger log = LoggerFactory.getLogger(AdaptiveThresholder.class);

    public static final double DEFAULT_PERCENTILE = 70.0;

    /**
     * Threshold actually applied: {@code explicitThreshold} as given when present, otherwise
     * the requested percentile of the field clamped into {@code range}.
     */
    public double resolve(IndexField field, Double explicitThreshold, double percentile, ThresholdRange range) {
        if (explicitThreshold != null) {
            if (explicitThreshold.isNaN() || explicitThreshold < 0.0 || explicitThreshold > 1.0) {
                throw new InvalidInputException("Explicit threshold must be within [0, 1] (got " + explicitThreshold + ")");
            }
            return explicitThreshold;
        }
        if (Double.isNaN(percentile) || percentile < 0.0 || percentile > 100.0) {
            throw new InvalidInputException("Percentile must be within [0, 100] (got " + percentile + ")");
        }
        double raw = field.percentile(percentile);
        double clamped = range.clamp(raw);
        log.debug("Percentile {} of index = {}, clamped into [{}, {}] -> {}",
                percentile, raw, range.min(), range.max(), clamped);
        return clamped;
    }

    /** Mask of pixels strictly above {@code threshold}. */
    public BinaryMask apply(IndexField field, double threshold) {
        boolean[] on = new boolean[field.size()];
        for (int i = 0; i < on.length; i++) {
            on[i] = field.get(i) > threshold;
        }
        return BinaryMask.wrap(field.width(), field.height(), on);
    }

    public BinaryMask threshold(IndexField field, Double explicitThreshold, double percentile, ThresholdRange range) {
        return apply(field, resolve(field, explicitThreshold, percentile, range));
    }
}
