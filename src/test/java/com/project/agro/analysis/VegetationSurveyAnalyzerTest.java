package com.project.agro.analysis;

import com.project.agro.analysis.DTOs.BasicAnalysisResult;
import com.project.agro.analysis.DTOs.ColorHistogram;
import com.project.agro.analysis.DTOs.CoverageResult;
import com.project.agro.analysis.DTOs.VegetationHealthResult;
import com.project.agro.analysis.exceptions.InvalidInputException;
import com.project.agro.analysis.imaging.AdaptiveThresholder;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.imaging.VegetationIndexComputer;
import com.project.agro.analysis.service.VegetationSurveyAnalyzer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VegetationSurveyAnalyzerTest {
    private final VegetationSurveyAnalyzer analyzer = new VegetationSurveyAnalyzer(
            new VegetationIndexComputer(), new AdaptiveThresholder(), Fixtures.validator());

    @Test
    void analyze_strongGreenFieldIsCoveredAndHealthy() {
        BasicAnalysisResult res = analyzer.analyze(PixelBuffer.filled(200, 200, 30, 120, 30));

        assertThat(res.coverage().vegetationPercentage()).isGreaterThan(90.0);
        assertThat(res.health().healthIndex()).isEqualTo(100.0);
        assertThat(res.health().healthyPercentage()).isEqualTo(100.0);
        assertThat(res.health().meanGli()).isEqualTo(0.6);
        assertThat(res.colors().predominantlyGreen()).isTrue();
        assertThat(res.colors().green().mean()).isEqualTo(120.0);
        assertThat(res.width()).isEqualTo(200);
    }

    @Test
    void coverage_grayFieldHasNoVegetation() {
        CoverageResult res = analyzer.coverage(PixelBuffer.filled(100, 100, 128, 128, 128), 0.3);

        assertThat(res.vegetationPixels()).isZero();
        assertThat(res.nonVegetationPercentage()).isEqualTo(100.0);
        assertThat(res.totalPixels()).isEqualTo(10_000);
    }

    @Test
    void health_bucketsByExcessGreen() {
        PixelBuffer plot = Fixtures.rectangles(10, 10, Fixtures.SOIL, Fixtures.LEAF, new int[]{0, 0, 5, 10});

        VegetationHealthResult res = analyzer.health(plot);

        assertThat(res.healthyPercentage()).isEqualTo(50.0);
        assertThat(res.nonVegetationPercentage()).isEqualTo(50.0);
        assertThat(res.vegetationTotalPercentage()).isEqualTo(50.0);
        assertThat(res.healthIndex()).isEqualTo(100.0);
    }

    @Test
    void histogram_countsEveryPixelPerChannel() {
        ColorHistogram hist = analyzer.histogram(PixelBuffer.filled(8, 8, 255, 120, 0), 32);

        assertThat(hist.red()).hasSize(32);
        assertThat(hist.red().get(31)).isEqualTo(64L);
        assertThat(hist.green().get(15)).isEqualTo(64L);
        assertThat(hist.blue().get(0)).isEqualTo(64L);
    }

    @Test
    void rejectsOutOfRangeParameters() {
        PixelBuffer buffer = PixelBuffer.filled(4, 4, 1, 2, 3);

        assertThatThrownBy(() -> analyzer.coverage(buffer, 1.5)).isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> analyzer.histogram(buffer, 1)).isInstanceOf(InvalidInputException.class);
    }
}
