package com.project.agro.analysis.service;

import com.project.agro.analysis.DTOs.AnalysisKind;
import com.project.agro.analysis.DTOs.AnalysisResult;
import com.project.agro.analysis.DTOs.BasicAnalysisResult;
import com.project.agro.analysis.DTOs.BiomassResult;
import com.project.agro.analysis.DTOs.CanopyCountResult;
import com.project.agro.analysis.DTOs.Region;
import com.project.agro.analysis.DTOs.RegionKind;
import com.project.agro.analysis.DTOs.SymptomResult;
import com.project.agro.analysis.config.BiomassConfig;
import com.project.agro.analysis.config.CanopyCountConfig;
import com.project.agro.analysis.config.SymptomConfig;
import com.project.agro.analysis.exceptions.InvalidInputException;
import com.project.agro.analysis.imaging.AdaptiveThresholder;
import com.project.agro.analysis.imaging.BinaryMask;
import com.project.agro.analysis.imaging.Colormap;
import com.project.agro.analysis.imaging.HeatmapRenderer;
import com.project.agro.analysis.imaging.IndexField;
import com.project.agro.analysis.imaging.MorphologicalSeparator;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.imaging.RegionExtractor;
import com.project.agro.analysis.imaging.ThresholdRange;
import com.project.agro.analysis.imaging.VegetationIndexComputer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.awt.geom.Point2D;
import java.util.List;

/**
 * Library boundary of the engine. Every call is synchronous, stateless and safe to run from
 * any number of worker threads at once; the caller owns threading and timeouts.
 * Out-of-range parameters fail with {@link InvalidInputException}.
 */
@Service
public class AerialAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(AerialAnalysisService.class);

    private final VegetationIndexComputer indexComputer;
    private final AdaptiveThresholder thresholder;
    private final MorphologicalSeparator separator;
    private final RegionExtractor extractor;
    private final HeatmapRenderer heatmapRenderer;
    private final CanopyCounter canopyCounter;
    private final SymptomClassifier symptomClassifier;
    private final BiomassEstimator biomassEstimator;
    private final VegetationSurveyAnalyzer surveyAnalyzer;
    private final RoiMasker roiMasker;
    private final ParameterValidator validator;

    private final CanopyCountConfig canopyDefaults;
    private final SymptomConfig symptomDefaults;
    private final BiomassConfig biomassDefaults;

    public AerialAnalysisService(VegetationIndexComputer indexComputer,
                                 AdaptiveThresholder thresholder,
                                 MorphologicalSeparator separator,
                                 RegionExtractor extractor,
                                 HeatmapRenderer heatmapRenderer,
                                 CanopyCounter canopyCounter,
                                 SymptomClassifier symptomClassifier,
                                 BiomassEstimator biomassEstimator,
                                 VegetationSurveyAnalyzer surveyAnalyzer,
                                 RoiMasker roiMasker,
                                 ParameterValidator validator,
                                 @Value("${app.analysis.canopy.max-dimension:2000}") int canopyMaxDimension,
                                 @Value("${app.analysis.symptom.max-dimension:1500}") int symptomMaxDimension,
                                 @Value("${app.analysis.biomass.max-dimension:1500}") int biomassMaxDimension) {
        this.indexComputer = indexComputer;
        this.thresholder = thresholder;
        this.separator = separator;
        this.extractor = extractor;
        this.heatmapRenderer = heatmapRenderer;
        this.canopyCounter = canopyCounter;
        this.symptomClassifier = symptomClassifier;
        this.biomassEstimator = biomassEstimator;
        this.surveyAnalyzer = surveyAnalyzer;
        this.roiMasker = roiMasker;
        this.validator = validator;
        this.canopyDefaults = validator.validate(CanopyCountConfig.defaults().withMaxDimension(canopyMaxDimension));
        this.symptomDefaults = validator.validate(SymptomConfig.defaults().withMaxDimension(symptomMaxDimension));
        this.biomassDefaults = validator.validate(BiomassConfig.defaults().withMaxDimension(biomassMaxDimension));
        log.debug("Downscale limits: canopy={}, symptom={}, biomass={}",
                canopyMaxDimension, symptomMaxDimension, biomassMaxDimension);
    }

    public IndexField computeVegetationIndex(PixelBuffer buffer) {
        return indexComputer.excessGreen(requireBuffer(buffer));
    }

    public IndexField computeGreenLeafIndex(PixelBuffer buffer) {
        return indexComputer.greenLeaf(requireBuffer(buffer));
    }

    public BinaryMask threshold(IndexField field, Double explicitThreshold, double percentile, ThresholdRange clampRange) {
        if (field == null || clampRange == null) {
            throw new InvalidInputException("Index field and clamp range are required");
        }
        if (explicitThreshold != null) {
            validator.requireRange("explicit threshold", explicitThreshold, 0.0, 1.0);
        }
        validator.requireRange("percentile", percentile, 0.0, 100.0);
        return thresholder.threshold(field, explicitThreshold, percentile, clampRange);
    }

    public BinaryMask separate(BinaryMask mask, int kernelSize, int erodeIterations, int dilateIterations) {
        if (mask == null) {
            throw new InvalidInputException("Mask is required");
        }
        return separator.separate(mask, kernelSize, erodeIterations, dilateIterations);
    }

    public List<Region> extractRegions(BinaryMask mask, long minArea, long maxArea, int maxRegions, double scale) {
        if (mask == null) {
            throw new InvalidInputException("Mask is required");
        }
        return extractor.extract(mask, RegionKind.CANOPY, minArea, maxArea, maxRegions, scale);
    }

    /** Maps regions back to an original image of the given size, one factor per axis. */
    public List<Region> extractRegions(BinaryMask mask, long minArea, long maxArea, int maxRegions,
                                       int originalWidth, int originalHeight) {
        if (mask == null) {
            throw new InvalidInputException("Mask is required");
        }
        return extractor.extract(mask, RegionKind.CANOPY, minArea, maxArea, maxRegions, originalWidth, originalHeight);
    }

    public CanopyCountResult countCanopies(PixelBuffer buffer) {
        return canopyCounter.count(requireBuffer(buffer), canopyDefaults);
    }

    public CanopyCountResult countCanopies(PixelBuffer buffer, long minArea, long maxArea) {
        return canopyCounter.count(requireBuffer(buffer), canopyDefaults.withAreaBounds(minArea, maxArea));
    }

    public CanopyCountResult countCanopies(PixelBuffer buffer, CanopyCountConfig config) {
        return canopyCounter.count(requireBuffer(buffer), config);
    }

    public SymptomResult classifySymptoms(PixelBuffer buffer) {
        return symptomClassifier.classify(requireBuffer(buffer), symptomDefaults);
    }

    public SymptomResult classifySymptoms(PixelBuffer buffer, double anomalyThreshold, long minRegionArea) {
        return symptomClassifier.classify(requireBuffer(buffer),
                symptomDefaults.withAnomalyThreshold(anomalyThreshold).withMinRegionArea(minRegionArea));
    }

    public SymptomResult classifySymptoms(PixelBuffer buffer, SymptomConfig config) {
        return symptomClassifier.classify(requireBuffer(buffer), config);
    }

    public BiomassResult estimateBiomass(PixelBuffer buffer) {
        return biomassEstimator.estimate(requireBuffer(buffer), biomassDefaults);
    }

    public BiomassResult estimateBiomass(PixelBuffer buffer, long minCanopyArea) {
        return biomassEstimator.estimate(requireBuffer(buffer), biomassDefaults.withMinCanopyArea(minCanopyArea));
    }

    public BiomassResult estimateBiomass(PixelBuffer buffer, BiomassConfig config) {
        return biomassEstimator.estimate(requireBuffer(buffer), config);
    }

    public PixelBuffer renderHeatmap(IndexField field, Colormap colormap) {
        if (field == null || colormap == null) {
            throw new InvalidInputException("Index field and colormap are required");
        }
        return heatmapRenderer.render(field, colormap);
    }

    public PixelBuffer renderHeatmap(PixelBuffer buffer, String colormap) {
        return renderHeatmap(computeVegetationIndex(buffer), Colormap.fromName(colormap));
    }

    public BasicAnalysisResult analyzeVegetation(PixelBuffer buffer) {
        return surveyAnalyzer.analyze(requireBuffer(buffer));
    }

    public RoiMasker.RoiMaskResult applyRoi(PixelBuffer buffer, List<Point2D.Double> polygon) {
        return roiMasker.apply(requireBuffer(buffer), polygon);
    }

    /** Runs one head with its default parameters. */
    public AnalysisResult analyze(PixelBuffer buffer, AnalysisKind kind) {
        if (kind == null) {
            throw new InvalidInputException("Analysis kind is required");
        }
        switch (kind) {
            case CANOPY_COUNT:
                return countCanopies(buffer);
            case SYMPTOMS:
                return classifySymptoms(buffer);
            case BIOMASS:
                return estimateBiomass(buffer);
            default:
                throw new InvalidInputException("Unsupported analysis kind: " + kind);
        }
    }

    private static PixelBuffer requireBuffer(PixelBuffer buffer) {
        if (buffer == null) {
            throw new InvalidInputException("Pixel buffer is required");
        }
        return buffer;
    }
}
