package com.project.agro.analysis.service;

import com.project.agro.analysis.DTOs.BiomassResult;
import com.project.agro.analysis.DTOs.DensityClass;
import com.project.agro.analysis.DTOs.Region;
import com.project.agro.analysis.DTOs.RegionKind;
import com.project.agro.analysis.DTOs.VigorMetrics;
import com.project.agro.analysis.config.BiomassConfig;
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
 * Biomass index from vegetation coverage, canopy density, green vigor and canopy texture.
 * <p>
 * Index weights: coverage 40%, canopy density 30%, vigor 15%, texture 15%. Each sub-score is
 * clamped to [0,100] before weighting. The kg/ha figure interpolates linearly between the
 * configured endpoints and is not physically calibrated.
 */
@Service
public class BiomassEstimator {
    private static final Logger log = LoggerFactory.getLogger(BiomassEstimator.class);

    private final VegetationIndexComputer indexComputer;
    private final AdaptiveThresholder thresholder;
    private final MorphologicalSeparator separator;
    private final RegionExtractor extractor;
    private final ParameterValidator validator;

    public BiomassEstimator(VegetationIndexComputer indexComputer, AdaptiveThresholder thresholder,
                            MorphologicalSeparator separator, RegionExtractor extractor,
                            ParameterValidator validator) {
        this.indexComputer = indexComputer;
        this.thresholder = thresholder;
        this.separator = separator;
        this.extractor = extractor;
        this.validator = validator;
    }

    public BiomassResult estimate(PixelBuffer buffer, BiomassConfig config) {
        validator.validate(config);
        log.info("Estimating biomass for {}x{} image, minCanopyArea={}",
                buffer.width(), buffer.height(), config.minCanopyArea());

        PixelBuffer.Scaled scaled = buffer.downscaledTo(config.maxDimension());
        PixelBuffer image = scaled.buffer();
        long totalPixels = image.pixelCount();

        IndexField exg = indexComputer.excessGreen(image);
        BinaryMask vegetation = thresholder.threshold(exg, null, config.percentile(),
                new ThresholdRange(config.thresholdMin(), config.thresholdMax()));
        int vegetationPixels = vegetation.countOn();

        if (vegetationPixels < config.minVegetationPixels()) {
            log.warn("Insufficient vegetation for biomass estimation ({} pixels)", vegetationPixels);
            return new BiomassResult(0.0, 0, 0, 0.0, 0.0, DensityClass.SPARSE, 0.0, List.of(), VigorMetrics.ZERO,
                    List.of("Vegetacao insuficiente para estimativa de biomassa."), config.minCanopyArea());
        }
        double coveragePct = Metrics.round(Metrics.percent(vegetationPixels, totalPixels), 2);

        BinaryMask separated = separator.separate(vegetation,
                config.kernelSize(), config.erodeIterations(), config.dilateIterations());
        List<Region> patches = extractor.extract(separated, RegionKind.CANOPY,
                config.minCanopyArea(), Long.MAX_VALUE, Integer.MAX_VALUE, scaled.originalWidth(), scaled.originalHeight());
        long canopyArea = 0;
        for (Region r : patches) canopyArea += r.areaPixels();
        double avgCanopyArea = patches.isEmpty() ? 0.0 : Metrics.round((double) canopyArea / patches.size(), 2);

        VigorMetrics vigor = vigorMetrics(image, vegetation, exg);

        double canopyDensityPct = Metrics.percent(canopyArea, scaled.originalPixelCount());
        double biomassIndex = computeBiomassIndex(config, coveragePct, canopyDensityPct,
                vigor.meanGreenIntensity(), vigor.textureVariance());
        DensityClass densityClass = DensityClass.fromBiomassIndex(biomassIndex);
        double kgHa = estimateKgHa(config, biomassIndex);

        log.debug("coverage={}%, canopies={} ({} px), vigor={}", coveragePct, patches.size(), canopyArea, vigor);
        BiomassResult result = new BiomassResult(
                coveragePct,
                patches.size(),
                canopyArea,
                avgCanopyArea,
                biomassIndex,
                densityClass,
                kgHa,
                patches.subList(0, Math.min(config.maxListedPatches(), patches.size())),
                vigor,
                recommendations(biomassIndex, densityClass, coveragePct, patches.size()),
                config.minCanopyArea());
        log.info("Biomass index {} ({}), ~{} kg/ha", biomassIndex, densityClass.code(), kgHa);
        return result;
    }

    /**
     * Weighted biomass index in [0,100], rounded to 2 decimals. Non-decreasing in every
     * argument.
     *
     * @param coveragePct        vegetation coverage, percent of image
     * @param canopyDensityPct   canopy area, percent of image
     * @param meanGreen          mean green channel inside vegetation, 0-255
     * @param textureVariance    grayscale variance inside vegetation
     */
    public double computeBiomassIndex(BiomassConfig config, double coveragePct, double canopyDensityPct,
                                      double meanGreen, double textureVariance) {
        double coverageScore = Metrics.clampPercent(coveragePct);
        double densityScore = Metrics.clampPercent(canopyDensityPct);
        double vigorScore = Metrics.clampPercent(meanGreen / 255.0 * 100.0);
        double textureScore = Metrics.clampPercent(textureVariance / config.textureVarianceCap() * 100.0);

        double index = coverageScore * config.coverageWeight()
                + densityScore * config.densityWeight()
                + vigorScore * config.vigorWeight()
                + textureScore * config.textureWeight();
        return Metrics.round(Metrics.clampPercent(Metrics.requireFinite("biomass index", index)), 2);
    }

    public double estimateKgHa(BiomassConfig config, double biomassIndex) {
        double kg = config.minBiomassKgHa()
                + (biomassIndex / 100.0) * (config.maxBiomassKgHa() - config.minBiomassKgHa());
        return Metrics.round(Metrics.requireFinite("biomass kg/ha", kg), 0);
    }

    private static VigorMetrics vigorMetrics(PixelBuffer image, BinaryMask vegetation, IndexField exg) {
        int[] gray = image.toGray();
        double greenSum = 0, graySum = 0, graySq = 0;
        int count = 0;
        for (int i = 0; i < gray.length; i++) {
            if (!vegetation.get(i)) continue;
            greenSum += image.green(i);
            graySum += gray[i];
            graySq += (double) gray[i] * gray[i];
            count++;
        }
        if (count == 0) {
            return VigorMetrics.ZERO;
        }
        double grayMean = graySum / count;
        double variance = Math.max(0.0, graySq / count - grayMean * grayMean);
        return new VigorMetrics(
                Metrics.round(Metrics.requireFinite("mean green", greenSum / count), 2),
                Metrics.round(Metrics.requireFinite("mean ExG", exg.mean(vegetation)), 4),
                Metrics.round(Metrics.requireFinite("texture variance", variance), 2));
    }

    private static List<String> recommendations(double biomassIndex, DensityClass densityClass,
                                                double coveragePct, int canopyCount) {
        List<String> recs = new ArrayList<>();
        switch (densityClass) {
            case VERY_DENSE:
                recs.add(String.format(Locale.ROOT, "Biomassa muito densa (indice %.1f). "
                        + "Area com excelente cobertura vegetal e alta produtividade.", biomassIndex));
                break;
            case DENSE:
                recs.add(String.format(Locale.ROOT, "Biomassa densa (indice %.1f). "
                        + "Boa cobertura vegetal. Monitorar para manter niveis atuais.", biomassIndex));
                break;
            case MODERATE:
                recs.add(String.format(Locale.ROOT, "Biomassa moderada (indice %.1f). "
                        + "Considere avaliar areas com menor cobertura para potencial de melhoria.", biomassIndex));
                break;
            default:
                recs.add(String.format(Locale.ROOT, "Biomassa esparsa (indice %.1f). "
                        + "Cobertura vegetal baixa. Verificar condicoes do solo e irrigacao.", biomassIndex));
        }
        if (coveragePct < 30) {
            recs.add("Cobertura vegetal abaixo de 30%. "
                    + "Considere replantio ou verificacao de fatores limitantes.");
        }
        if (canopyCount == 0 && coveragePct > 10) {
            recs.add("Vegetacao presente mas sem copas individuais identificadas. "
                    + "Pode indicar vegetacao rasteira ou gramado uniforme.");
        }
        return recs;
    }
}
