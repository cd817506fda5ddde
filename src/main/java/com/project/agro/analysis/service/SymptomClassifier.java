package com.project.agro.analysis.service;

import com.project.agro.analysis.DTOs.Region;
import com.project.agro.analysis.DTOs.RegionKind;
import com.project.agro.analysis.DTOs.Severity;
import com.project.agro.analysis.DTOs.SymptomResult;
import com.project.agro.analysis.config.SymptomConfig;
import com.project.agro.analysis.imaging.AdaptiveThresholder;
import com.project.agro.analysis.imaging.BinaryMask;
import com.project.agro.analysis.imaging.HsvImage;
import com.project.agro.analysis.imaging.IndexField;
import com.project.agro.analysis.imaging.LocalStatistics;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.imaging.RegionExtractor;
import com.project.agro.analysis.imaging.ThresholdRange;
import com.project.agro.analysis.imaging.VegetationIndexComputer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Heuristic pest/disease screening on color and texture: yellowing (chlorosis), browning
 * (necrosis) and local texture outliers inside the vegetation mask.
 */
@Service
public class SymptomClassifier {
    private static final Logger log = LoggerFactory.getLogger(SymptomClassifier.class);

    private static final double STD_EPSILON = 1e-10;

    private final VegetationIndexComputer indexComputer;
    private final AdaptiveThresholder thresholder;
    private final RegionExtractor extractor;
    private final ParameterValidator validator;

    public SymptomClassifier(VegetationIndexComputer indexComputer, AdaptiveThresholder thresholder,
                             RegionExtractor extractor, ParameterValidator validator) {
        this.indexComputer = indexComputer;
        this.thresholder = thresholder;
        this.extractor = extractor;
        this.validator = validator;
    }

    public SymptomResult classify(PixelBuffer buffer, SymptomConfig config) {
        validator.validate(config);
        log.info("Classifying symptoms in {}x{} image, anomalyThreshold={}, minRegionArea={}",
                buffer.width(), buffer.height(), config.anomalyThreshold(), config.minRegionArea());

        PixelBuffer.Scaled scaled = buffer.downscaledTo(config.maxDimension());
        PixelBuffer image = scaled.buffer();

        IndexField exg = indexComputer.excessGreen(image);
        BinaryMask vegetation = thresholder.threshold(exg, null, config.vegetationPercentile(),
                new ThresholdRange(config.vegetationThresholdMin(), config.vegetationThresholdMax()));
        int vegetationPixels = vegetation.countOn();
        long reportedVegetation = toOriginalPixels(vegetationPixels, scaled);

        if (vegetationPixels < config.minVegetationPixels()) {
            log.warn("Insufficient vegetation for symptom analysis ({} pixels)", vegetationPixels);
            return new SymptomResult(reportedVegetation, 0.0, 0.0, 0.0, 0.0, 0.0, Severity.HEALTHY,
                    List.of(), List.of("Vegetacao insuficiente para analise de pragas/doencas."), parameters(config));
        }

        HsvImage hsv = HsvImage.of(image);
        BinaryMask necrosis = necrosisMask(hsv, vegetation, config);
        BinaryMask chlorosis = chlorosisMask(hsv, vegetation, config).andNot(necrosis);
        BinaryMask anomaly = textureAnomalyMask(image, vegetation, config).andNot(necrosis).andNot(chlorosis);

        double chlorosisPct = Metrics.round(Metrics.percent(chlorosis.countOn(), vegetationPixels), 2);
        double necrosisPct = Metrics.round(Metrics.percent(necrosis.countOn(), vegetationPixels), 2);
        double anomalyPct = Metrics.round(Metrics.percent(anomaly.countOn(), vegetationPixels), 2);
        double infectionRate = Metrics.round(chlorosisPct + necrosisPct + anomalyPct, 2);
        double healthyPct = Metrics.round(Math.max(100.0 - infectionRate, 0.0), 2);
        Severity severity = Severity.fromInfectionRate(infectionRate);
        log.debug("Vegetation {} px: chlorosis {}%, necrosis {}%, anomaly {}%",
                vegetationPixels, chlorosisPct, necrosisPct, anomalyPct);

        List<Region> regions = new ArrayList<>();
        regions.addAll(categoryRegions(chlorosis, RegionKind.CHLOROSIS, config, scaled));
        regions.addAll(categoryRegions(necrosis, RegionKind.NECROSIS, config, scaled));
        regions.addAll(categoryRegions(anomaly, RegionKind.TEXTURE_ANOMALY, config, scaled));
        regions.sort(Comparator.comparingLong(Region::areaPixels).reversed());

        List<Region> affected = new ArrayList<>();
        for (int i = 0; i < Math.min(config.maxRegions(), regions.size()); i++) {
            affected.add(regions.get(i).withId(i + 1));
        }

        SymptomResult result = new SymptomResult(reportedVegetation, healthyPct, chlorosisPct, necrosisPct, anomalyPct,
                infectionRate, severity, affected,
                recommendations(severity, chlorosisPct, necrosisPct, anomalyPct), parameters(config));
        log.info("Symptom severity {} (infection rate {}%, {} regions)",
                severity.code(), infectionRate, affected.size());
        return result;
    }

    private List<Region> categoryRegions(BinaryMask mask, RegionKind kind, SymptomConfig config, PixelBuffer.Scaled scaled) {
        return extractor.extract(mask, kind, config.minRegionArea(), Long.MAX_VALUE,
                config.maxRegionsPerCategory(), scaled.originalWidth(), scaled.originalHeight());
    }

    private static BinaryMask chlorosisMask(HsvImage hsv, BinaryMask vegetation, SymptomConfig config) {
        boolean[] on = new boolean[vegetation.size()];
        for (int i = 0; i < on.length; i++) {
            float h = hsv.hue(i);
            on[i] = vegetation.get(i)
                    && h >= config.chlorosisHueMin() && h <= config.chlorosisHueMax()
                    && hsv.saturation(i) > config.chlorosisSaturationMin();
        }
        return BinaryMask.of(vegetation.width(), vegetation.height(), on);
    }

    private static BinaryMask necrosisMask(HsvImage hsv, BinaryMask vegetation, SymptomConfig config) {
        boolean[] on = new boolean[vegetation.size()];
        for (int i = 0; i < on.length; i++) {
            float h = hsv.hue(i);
            on[i] = vegetation.get(i)
                    && h >= config.necrosisHueMin() && h <= config.necrosisHueMax()
                    && hsv.saturation(i) > config.necrosisSaturationMin()
                    && hsv.value(i) < config.necrosisValueMax();
        }
        return BinaryMask.of(vegetation.width(), vegetation.height(), on);
    }

    /** Pixels whose grayscale z-score against the surrounding window exceeds the threshold. */
    private static BinaryMask textureAnomalyMask(PixelBuffer image, BinaryMask vegetation, SymptomConfig config) {
        int[] gray = image.toGray();
        LocalStatistics stats = LocalStatistics.of(gray, image.width(), image.height(), config.textureWindow());
        boolean[] on = new boolean[gray.length];
        for (int i = 0; i < gray.length; i++) {
            if (!vegetation.get(i)) continue;
            double z = Math.abs(gray[i] - stats.mean(i)) / (stats.std(i) + STD_EPSILON);
            on[i] = z > config.anomalyThreshold();
        }
        return BinaryMask.of(image.width(), image.height(), on);
    }

    private static long toOriginalPixels(int analyzedPixels, PixelBuffer.Scaled scaled) {
        if (scaled.scale() == 1.0) return analyzedPixels;
        return Math.min(Math.round(analyzedPixels * scaled.areaFactor()), scaled.originalPixelCount());
    }

    private static SymptomResult.Parameters parameters(SymptomConfig config) {
        return new SymptomResult.Parameters(config.chlorosisHueMin(), config.chlorosisHueMax(),
                config.necrosisHueMin(), config.necrosisHueMax(), config.anomalyThreshold(), config.minRegionArea());
    }

    static List<String> recommendations(Severity severity, double chlorosisPct, double necrosisPct, double anomalyPct) {
        List<String> recs = new ArrayList<>();
        if (severity == Severity.HEALTHY) {
            recs.add("Vegetacao saudavel. Manter monitoramento regular.");
            return recs;
        }
        if (chlorosisPct > 5) {
            recs.add(String.format(Locale.ROOT, "Clorose detectada em %.1f%% da vegetacao. "
                    + "Verificar deficiencia de nitrogenio, ferro ou magnesio.", chlorosisPct));
        }
        if (necrosisPct > 5) {
            recs.add(String.format(Locale.ROOT, "Necrose detectada em %.1f%% da vegetacao. "
                    + "Investigar possivel infeccao fungica ou bacteriana.", necrosisPct));
        }
        if (anomalyPct > 5) {
            recs.add(String.format(Locale.ROOT, "Anomalias de textura em %.1f%% da vegetacao. "
                    + "Pode indicar danos por insetos ou estresse hidrico.", anomalyPct));
        }
        switch (severity) {
            case SEVERE:
                recs.add("Severidade alta. Recomenda-se inspecao presencial urgente "
                        + "e coleta de amostras para diagnostico laboratorial.");
                break;
            case MODERATE:
                recs.add("Severidade moderada. Agendar inspecao presencial para "
                        + "confirmar diagnostico e iniciar tratamento.");
                break;
            default:
                recs.add("Severidade leve. Continuar monitoramento e observar "
                        + "evolucao nas proximas semanas.");
        }
        return recs;
    }
}
