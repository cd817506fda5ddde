package com.project.agro.analysis.service;

import com.project.agro.analysis.DTOs.CanopyCountResult;
import com.project.agro.analysis.DTOs.Region;
import com.project.agro.analysis.DTOs.RegionKind;
import com.project.agro.analysis.config.CanopyCountConfig;
import com.project.agro.analysis.imaging.AdaptiveThresholder;
import com.project.agro.analysis.imaging.BinaryMask;
import com.project.agro.analysis.imaging.IndexField;
import com.project.agro.analysis.imaging.MorphologicalSeparator;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.imaging.RegionExtractor;
import com.project.agro.analysis.imaging.ThresholdRange;
import com.project.agro.analysis.imaging.VegetationIndexComputer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Counts individual tree/plant crowns: ExG, percentile threshold, erosion to split touching
 * crowns, then connected components filtered by area.
 */
@Service
public class CanopyCounter {
    private static final Logger log = LoggerFactory.getLogger(CanopyCounter.class);

    private final VegetationIndexComputer indexComputer;
    private final AdaptiveThresholder thresholder;
    private final MorphologicalSeparator separator;
    private final RegionExtractor extractor;
    private final ParameterValidator validator;

    public CanopyCounter(VegetationIndexComputer indexComputer, AdaptiveThresholder thresholder,
                         MorphologicalSeparator separator, RegionExtractor extractor,
                         ParameterValidator validator) {
        this.indexComputer = indexComputer;
        this.thresholder = thresholder;
        this.separator = separator;
        this.extractor = extractor;
        this.validator = validator;
    }

    public CanopyCountResult count(PixelBuffer buffer, CanopyCountConfig config) {
        validator.validate(config);
        log.info("Counting canopies in {}x{} image, area bounds [{}, {}]",
                buffer.width(), buffer.height(), config.minArea(), config.maxArea());

        PixelBuffer.Scaled scaled = buffer.downscaledTo(config.maxDimension());
        if (scaled.scale() < 1.0) {
            log.debug("Analyzing downscaled copy {}x{} (scale {})",
                    scaled.buffer().width(), scaled.buffer().height(), scaled.scale());
        }

        IndexField exg = indexComputer.excessGreen(scaled.buffer());
        double threshold = thresholder.resolve(exg, config.explicitThreshold(), config.percentile(),
                new ThresholdRange(config.thresholdMin(), config.thresholdMax()));
        BinaryMask vegetation = thresholder.apply(exg, threshold);

        int vegetationPixels = vegetation.countOn();
        log.debug("ExG threshold {} -> {} vegetation pixels", threshold, vegetationPixels);
        if (vegetationPixels < config.minVegetationPixels()) {
            log.warn("Insufficient vegetation for canopy counting ({} pixels)", vegetationPixels);
            return emptyResult(buffer, threshold, config);
        }

        BinaryMask separated = separator.separate(vegetation,
                config.kernelSize(), config.erodeIterations(), config.dilateIterations());
        List<Region> canopies = extractor.extract(separated, RegionKind.CANOPY,
                config.minArea(), config.maxArea(), Integer.MAX_VALUE, scaled.originalWidth(), scaled.originalHeight());

        long totalArea = 0;
        long minArea = canopies.isEmpty() ? 0 : Long.MAX_VALUE;
        long maxArea = 0;
        for (Region r : canopies) {
            totalArea += r.areaPixels();
            minArea = Math.min(minArea, r.areaPixels());
            maxArea = Math.max(maxArea, r.areaPixels());
        }
        double avgArea = canopies.isEmpty() ? 0.0 : (double) totalArea / canopies.size();
        double coverage = Metrics.clampPercent(Metrics.percent(totalArea, scaled.originalPixelCount()));

        List<Region> listed = canopies.subList(0, Math.min(config.maxListedRegions(), canopies.size()));
        CanopyCountResult result = new CanopyCountResult(
                canopies.size(),
                totalArea,
                Metrics.round(Metrics.requireFinite("coverage percentage", coverage), 2),
                Metrics.round(Metrics.requireFinite("average canopy area", avgArea), 1),
                minArea,
                maxArea,
                listed,
                buffer.width(),
                buffer.height(),
                threshold,
                config.minArea(),
                config.maxArea(),
                recommendations(canopies.size(), coverage));

        log.info("Found {} canopies covering {}% of the image", result.totalCanopies(), result.coveragePercentage());
        return result;
    }

    private CanopyCountResult emptyResult(PixelBuffer buffer, double threshold, CanopyCountConfig config) {
        return new CanopyCountResult(0, 0, 0.0, 0.0, 0, 0, List.of(),
                buffer.width(), buffer.height(), threshold, config.minArea(), config.maxArea(),
                List.of("Vegetacao insuficiente para contagem de copas."));
    }

    private static List<String> recommendations(int count, double coverage) {
        List<String> recs = new ArrayList<>();
        if (count == 0) {
            recs.add("Nenhuma copa individual identificada. Verifique os limites de area minima e maxima.");
        } else if (coverage < 10) {
            recs.add(String.format(Locale.ROOT, "Cobertura de copas baixa (%.1f%%). Avaliar falhas de plantio.", coverage));
        }
        return recs;
    }
}
