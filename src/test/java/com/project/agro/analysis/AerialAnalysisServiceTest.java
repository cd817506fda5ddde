package com.project.agro.analysis;

import com.project.agro.analysis.DTOs.AnalysisKind;
import com.project.agro.analysis.DTOs.AnalysisResult;
import com.project.agro.analysis.DTOs.BiomassResult;
import com.project.agro.analysis.DTOs.CanopyCountResult;
import com.project.agro.analysis.DTOs.SymptomResult;
import com.project.agro.analysis.exceptions.InvalidInputException;
import com.project.agro.analysis.imaging.AdaptiveThresholder;
import com.project.agro.analysis.imaging.HeatmapRenderer;
import com.project.agro.analysis.imaging.MorphologicalSeparator;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.imaging.RegionExtractor;
import com.project.agro.analysis.imaging.ThresholdRange;
import com.project.agro.analysis.imaging.VegetationIndexComputer;
import com.project.agro.analysis.service.AerialAnalysisService;
import com.project.agro.analysis.service.ParameterValidator;
import com.project.agro.analysis.service.RoiMasker;
import com.project.agro.analysis.service.VegetationSurveyAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AerialAnalysisServiceTest {
    private final AerialAnalysisService service = newService();

    private static AerialAnalysisService newService() {
        ParameterValidator validator = Fixtures.validator();
        VegetationIndexComputer index = new VegetationIndexComputer();
        AdaptiveThresholder thresholder = new AdaptiveThresholder();
        return new AerialAnalysisService(index, thresholder, new MorphologicalSeparator(), new RegionExtractor(),
                new HeatmapRenderer(), Fixtures.canopyCounter(), Fixtures.symptomClassifier(),
                Fixtures.biomassEstimator(), new VegetationSurveyAnalyzer(index, thresholder, validator),
                new RoiMasker(), validator, 2000, 1500, 1500);
    }

    @Test
    void analyze_dispatchesToEachHead() {
        PixelBuffer orchard = Fixtures.orchard(200, 200, 10, 40);

        AnalysisResult canopy = service.analyze(orchard, AnalysisKind.CANOPY_COUNT);
        AnalysisResult symptoms = service.analyze(orchard, AnalysisKind.SYMPTOMS);
        AnalysisResult biomass = service.analyze(orchard, AnalysisKind.BIOMASS);

        assertThat(canopy).isInstanceOf(CanopyCountResult.class);
        assertThat(canopy.regions()).hasSize(25);
        assertThat(symptoms).isInstanceOf(SymptomResult.class);
        assertThat(symptoms.kind()).isEqualTo(AnalysisKind.SYMPTOMS);
        assertThat(biomass).isInstanceOf(BiomassResult.class);
        assertThat(biomass.recommendations()).isNotEmpty();
    }

    @Test
    void grayField_yieldsNothingAnywhere() {
        PixelBuffer gray = PixelBuffer.filled(100, 100, 128, 128, 128);

        assertThat(service.countCanopies(gray).totalCanopies()).isZero();
        assertThat(service.estimateBiomass(gray).biomassIndex()).isZero();
        assertThat(service.threshold(service.computeVegetationIndex(gray), null, 70, ThresholdRange.UNIT).countOn()).isZero();
    }

    @Test
    void primitivesChainIntoRegions() {
        PixelBuffer orchard = Fixtures.orchard(200, 200, 10, 40);

        var mask = service.threshold(service.computeVegetationIndex(orchard), null, 70, new ThresholdRange(0.5, 0.7));
        var separated = service.separate(mask, 5, 2, 1);

        assertThat(service.extractRegions(separated, 50, 15000, 100, 1.0)).hasSize(25);
        assertThat(service.extractRegions(separated, 50, 15000, 100, 200, 200))
                .isEqualTo(service.extractRegions(separated, 50, 15000, 100, 1.0));
        assertThat(service.computeGreenLeafIndex(orchard).max()).isGreaterThan(0.5f);
    }

    @Test
    void renderHeatmap_fromBufferByName() {
        PixelBuffer heatmap = service.renderHeatmap(PixelBuffer.filled(3, 3, 30, 120, 30), "jet");

        assertThat(heatmap.green(1, 1)).isEqualTo(255);
        assertThat(heatmap.red(1, 1)).isZero();
        assertThatThrownBy(() -> service.renderHeatmap(PixelBuffer.filled(3, 3, 0, 0, 0), "rainbow"))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsInvalidCallerParameters() {
        PixelBuffer orchard = Fixtures.orchard(100, 100, 10, 40);

        assertThatThrownBy(() -> service.countCanopies(orchard, 5, 100)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.countCanopies(orchard, 50, 2_000_000)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.classifySymptoms(orchard, 10.0, 100)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.estimateBiomass(orchard, 20_000)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.threshold(service.computeVegetationIndex(orchard), null, 150, ThresholdRange.UNIT))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.countCanopies(null)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> service.analyze(orchard, null)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    void concurrentCallsReturnIdenticalResults() throws Exception {
        PixelBuffer orchard = Fixtures.orchard(200, 200, 10, 40);
        CanopyCountResult expected = service.countCanopies(orchard);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<CanopyCountResult>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> service.countCanopies(orchard)));
            }
            for (Future<CanopyCountResult> f : futures) {
                assertThat(f.get()).isEqualTo(expected);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
