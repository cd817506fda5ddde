package com.project.agro.analysis.service;

import com.project.agro.analysis.DTOs.BasicAnalysisResult;
import com.project.agro.analysis.DTOs.ColorHistogram;
import com.project.agro.analysis.DTOs.ColorStatistics;
import com.project.agro.analysis.DTOs.CoverageResult;
import com.project.agro.analysis.DTOs.VegetationHealthResult;
import com.project.agro.analysis.imaging.AdaptiveThresholder;
import com.project.agro.analysis.imaging.IndexField;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.imaging.VegetationIndexComputer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Whole-image vegetation survey: coverage, ExG health bands and color statistics.
 * Simplified estimates for RGB imagery; a real vigor assessment needs a NIR band.
 */
@Service
public class VegetationSurveyAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(VegetationSurveyAnalyzer.class);

    public static final double DEFAULT_COVERAGE_THRESHOLD = 0.3;
    public static final int DEFAULT_HISTOGRAM_BINS = 32;

    static final double HEALTHY_EXG = 0.5;
    static final double MODERATE_EXG = 0.25;
    static final double STRESSED_EXG = 0.1;

    private final VegetationIndexComputer indexComputer;
    private final AdaptiveThresholder thresholder;
    private final ParameterValidator validator;

    public VegetationSurveyAnalyzer(VegetationIndexComputer indexComputer, AdaptiveThresholder thresholder,
                                    ParameterValidator validator) {
        this.indexComputer = indexComputer;
        this.thresholder = thresholder;
        this.validator = validator;
    }

    public CoverageResult coverage(PixelBuffer buffer, double threshold) {
        validator.requireRange("coverage threshold", threshold, 0.0, 1.0);
        IndexField exg = indexComputer.excessGreen(buffer);
        long vegetation = thresholder.apply(exg, threshold).countOn();
        long total = buffer.pixelCount();
        double pct = Metrics.round(Metrics.percent(vegetation, total), 2);
        return new CoverageResult(pct, Metrics.round(100.0 - pct, 2), total, vegetation, threshold);
    }

    public VegetationHealthResult health(PixelBuffer buffer) {
        IndexField exg = indexComputer.excessGreen(buffer);
        IndexField gli = indexComputer.greenLeaf(buffer);

        long healthy = 0, moderate = 0, stressed = 0, nonVegetation = 0;
        for (int i = 0; i < exg.size(); i++) {
            float v = exg.get(i);
            if (v > HEALTHY_EXG) healthy++;
            else if (v > MODERATE_EXG) moderate++;
            else if (v > STRESSED_EXG) stressed++;
            else nonVegetation++;
        }
        long total = exg.size();
        double healthyPct = Metrics.percent(healthy, total);
        double moderatePct = Metrics.percent(moderate, total);
        double stressedPct = Metrics.percent(stressed, total);
        double vegetationTotal = healthyPct + moderatePct + stressedPct;
        double healthIndex = vegetationTotal > 0
                ? (healthyPct * 100 + moderatePct * 70 + stressedPct * 30) / vegetationTotal
                : 0.0;

        return new VegetationHealthResult(
                Metrics.round(healthIndex, 1),
                Metrics.round(healthyPct, 1),
                Metrics.round(moderatePct, 1),
                Metrics.round(stressedPct, 1),
                Metrics.round(Metrics.percent(nonVegetation, total), 1),
                Metrics.round(vegetationTotal, 1),
                Metrics.round(exg.mean(), 3),
                Metrics.round(gli.mean(), 3));
    }

    public ColorStatistics colorStatistics(PixelBuffer buffer) {
        int n = buffer.pixelCount();
        double[] sum = new double[3], sumSq = new double[3];
        int[] min = {255, 255, 255}, max = {0, 0, 0};
        for (int i = 0; i < n; i++) {
            int[] c = {buffer.red(i), buffer.green(i), buffer.blue(i)};
            for (int ch = 0; ch < 3; ch++) {
                sum[ch] += c[ch];
                sumSq[ch] += (double) c[ch] * c[ch];
                min[ch] = Math.min(min[ch], c[ch]);
                max[ch] = Math.max(max[ch], c[ch]);
            }
        }
        ColorStatistics.ChannelStatistics[] channels = new ColorStatistics.ChannelStatistics[3];
        for (int ch = 0; ch < 3; ch++) {
            double mean = sum[ch] / n;
            double std = Math.sqrt(Math.max(0.0, sumSq[ch] / n - mean * mean));
            channels[ch] = new ColorStatistics.ChannelStatistics(mean, std, min[ch], max[ch]);
        }
        double brightness = (sum[0] + sum[1] + sum[2]) / (3.0 * n);
        boolean predominantlyGreen = channels[1].mean() > channels[0].mean() && channels[1].mean() > channels[2].mean();
        return new ColorStatistics(channels[0], channels[1], channels[2], brightness, predominantlyGreen);
    }

    public ColorHistogram histogram(PixelBuffer buffer, int bins) {
        validator.requireRange("histogram bins", bins, 2, 256);
        long[][] counts = new long[3][bins];
        for (int i = 0; i < buffer.pixelCount(); i++) {
            counts[0][buffer.red(i) * bins / 256]++;
            counts[1][buffer.green(i) * bins / 256]++;
            counts[2][buffer.blue(i) * bins / 256]++;
        }
        return new ColorHistogram(bins, toList(counts[0]), toList(counts[1]), toList(counts[2]));
    }

    public BasicAnalysisResult analyze(PixelBuffer buffer) {
        log.info("Running basic vegetation survey on {}x{} image", buffer.width(), buffer.height());
        BasicAnalysisResult result = new BasicAnalysisResult(
                coverage(buffer, DEFAULT_COVERAGE_THRESHOLD),
                health(buffer),
                colorStatistics(buffer),
                histogram(buffer, DEFAULT_HISTOGRAM_BINS),
                buffer.width(),
                buffer.height());
        log.info("Vegetation {}%, health index {}",
                result.coverage().vegetationPercentage(), result.health().healthIndex());
        return result;
    }

    private static List<Long> toList(long[] values) {
        List<Long> out = new ArrayList<>(values.length);
        for (long v : values) out.add(v);
        return out;
    }
}
