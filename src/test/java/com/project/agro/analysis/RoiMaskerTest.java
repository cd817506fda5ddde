package com.project.agro.analysis;

import com.project.agro.analysis.exceptions.InvalidInputException;
import com.project.agro.analysis.imaging.PixelBuffer;
import com.project.agro.analysis.service.RoiMasker;
import org.junit.jupiter.api.Test;

import java.awt.geom.Point2D;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoiMaskerTest {
    private final RoiMasker masker = new RoiMasker();

    private static List<Point2D.Double> square() {
        return List.of(new Point2D.Double(10, 10), new Point2D.Double(60, 10),
                new Point2D.Double(60, 60), new Point2D.Double(10, 60));
    }

    @Test
    void apply_zeroesOutsideAndDescribesPolygon() {
        PixelBuffer field = PixelBuffer.filled(100, 100, 30, 120, 30);

        RoiMasker.RoiMaskResult res = masker.apply(field, square());

        assertThat(res.masked().green(5, 5)).isZero();
        assertThat(res.masked().green(30, 30)).isEqualTo(120);
        assertThat(field.green(5, 5)).isEqualTo(120);
        assertThat(res.metadata().areaPixels()).isBetween(2500L, 2601L);
        assertThat(res.metadata().perimeterPixels()).isEqualTo(200.0);
        assertThat(res.metadata().xMin()).isEqualTo(10.0);
        assertThat(res.metadata().yMax()).isEqualTo(60.0);
        assertThat(res.metadata().numVertices()).isEqualTo(4);
        assertThat(res.metadata().coveragePct()).isBetween(25.0, 26.01);
        assertThat(res.roi().countOn()).isEqualTo((int) res.metadata().areaPixels());
    }

    @Test
    void apply_needsThreeVertices() {
        PixelBuffer field = PixelBuffer.filled(10, 10, 0, 0, 0);

        assertThatThrownBy(() -> masker.apply(field, List.of(new Point2D.Double(0, 0), new Point2D.Double(5, 5))))
                .isInstanceOf(InvalidInputException.class);
    }
}
