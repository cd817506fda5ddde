package com.project.agro.analysis;

import com.project.agro.analysis.DTOs.BoundingBox;
import com.project.agro.analysis.DTOs.Region;
import com.project.agro.analysis.DTOs.RegionKind;
import com.project.agro.analysis.exceptions.InvalidInputException;
import com.project.agro.analysis.imaging.BinaryMask;
import com.project.agro.analysis.imaging.MorphologicalSeparator;
import com.project.agro.analysis.imaging.RegionExtractor;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegionExtractorTest {
    private final RegionExtractor extractor = new RegionExtractor();

    private static BinaryMask touchingSquares() {
        return Fixtures.squares(150, 150, new int[]{10, 10, 60, 60}, new int[]{70, 70, 60, 60});
    }

    @Test
    void extract_diagonalContactIsOneRegion() {
        List<Region> regions = extractor.extract(touchingSquares(), RegionKind.CANOPY, 0, Long.MAX_VALUE, 100, 1.0);

        assertThat(regions).hasSize(1);
        Region merged = regions.get(0);
        assertThat(merged.areaPixels()).isEqualTo(7200);
        assertThat(merged.bbox()).isEqualTo(new BoundingBox(10, 10, 129, 129));
        assertThat(merged.id()).isEqualTo(1);
    }

    @Test
    void extract_afterErosionFindsTwoRegions() {
        BinaryMask split = new MorphologicalSeparator().separate(touchingSquares(), 3, 2, 1);

        List<Region> regions = extractor.extract(split, RegionKind.CANOPY, 0, Long.MAX_VALUE, 100, 1.0);

        assertThat(regions).hasSize(2);
        assertThat(regions).allSatisfy(r -> assertThat(r.areaPixels()).isBetween(3000L, 3600L));
        assertThat(regions).extracting(Region::id).containsExactly(1, 2);
    }

    @Test
    void extract_ordersByAreaAndFiltersBounds() {
        BinaryMask mask = Fixtures.squares(100, 100,
                new int[]{0, 0, 5, 5},      // 25
                new int[]{20, 20, 10, 10},  // 100
                new int[]{50, 50, 30, 30}); // 900

        List<Region> regions = extractor.extract(mask, RegionKind.NECROSIS, 50, 500, 10, 1.0);

        assertThat(regions).hasSize(1);
        assertThat(regions.get(0).areaPixels()).isEqualTo(100);
        assertThat(regions.get(0).centerX()).isEqualTo(24);
        assertThat(regions.get(0).centerY()).isEqualTo(24);
        assertThat(regions.get(0).kind()).isEqualTo(RegionKind.NECROSIS);

        List<Region> all = extractor.extract(mask, RegionKind.CANOPY, 0, Long.MAX_VALUE, 2, 1.0);
        assertThat(all).extracting(Region::areaPixels).containsExactly(900L, 100L);
    }

    @Test
    void extract_emptyMaskGivesNoRegions() {
        assertThat(extractor.extract(BinaryMask.empty(10, 10), RegionKind.CANOPY, 0, 100, 10, 1.0)).isEmpty();
    }

    @Test
    void extract_mapsDownscaledRegionsBackToOriginal() {
        BinaryMask analyzed = Fixtures.squares(50, 50, new int[]{10, 10, 10, 10}, new int[]{40, 40, 10, 10});

        List<Region> regions = extractor.extract(analyzed, RegionKind.CANOPY, 0, Long.MAX_VALUE, 10, 0.5);

        assertThat(regions).hasSize(2);
        assertThat(regions).allSatisfy(r -> {
            assertThat(r.areaPixels()).isEqualTo(400);
            assertThat(r.bbox().containedIn(100, 100)).isTrue();
        });
        assertThat(regions).anySatisfy(r -> assertThat(r.bbox()).isEqualTo(new BoundingBox(80, 80, 99, 99)));
    }

    @Test
    void extract_mapsEachAxisWithItsOwnFactor() {
        // a 5000x1 strip analyzed at 2000x1: only the long side was shrunk
        boolean[] bits = new boolean[2000];
        Arrays.fill(bits, true);

        List<Region> regions = extractor.extract(BinaryMask.of(2000, 1, bits), RegionKind.CANOPY,
                0, Long.MAX_VALUE, 10, 5000, 1);

        assertThat(regions).hasSize(1);
        assertThat(regions.get(0).areaPixels()).isEqualTo(5000);
        assertThat(regions.get(0).bbox()).isEqualTo(new BoundingBox(0, 0, 4999, 0));
        assertThat(regions.get(0).centerY()).isZero();
    }

    @Test
    void extract_isRepeatableWithAreaTies() {
        BinaryMask mask = Fixtures.squares(60, 60, new int[]{30, 5, 10, 10}, new int[]{5, 30, 10, 10});

        List<Region> first = extractor.extract(mask, RegionKind.CANOPY, 0, Long.MAX_VALUE, 10, 1.0);
        List<Region> second = extractor.extract(mask, RegionKind.CANOPY, 0, Long.MAX_VALUE, 10, 1.0);

        assertThat(second).isEqualTo(first);
        assertThat(first).extracting(Region::id).containsExactly(1, 2);
        assertThat(first).extracting(Region::areaPixels).containsExactly(100L, 100L);
        // equal areas keep scan order: the upper square is labeled first
        assertThat(first.get(0).bbox()).isEqualTo(new BoundingBox(30, 5, 39, 14));
    }

    @Test
    void extract_rejectsOriginalSmallerThanMask() {
        assertThatThrownBy(() -> extractor.extract(BinaryMask.empty(10, 10), RegionKind.CANOPY, 0, 10, 10, 5, 10))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void extract_rejectsInvertedAreaBounds() {
        assertThatThrownBy(() -> extractor.extract(BinaryMask.empty(5, 5), RegionKind.CANOPY, 100, 10, 10, 1.0))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> extractor.extract(BinaryMask.empty(5, 5), RegionKind.CANOPY, 0, 10, 10, 0.0))
                .isInstanceOf(InvalidInputException.class);
    }
}
