package com.project.agro.analysis.imaging;

import com.project.agro.analysis.DTOs.BoundingBox;
import com.project.agro.analysis.DTOs.Region;
import com.project.agro.analysis.DTOs.RegionKind;
import com.project.agro.analysis.exceptions.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 8-connected component labeling with per-component area, bounds and centroid.
 */
@Component
public class RegionExtractor {
    private static final Logger log = LoggerFactory.getLogger(RegionExtractor.class);

    private static final int[] DX = {-1, 0, 1, -1, 1, -1, 0, 1};
    private static final int[] DY = {-1, -1, -1, 0, 0, 1, 1, 1};

    /**
     * Labels {@code mask}, keeps components whose area lies in {@code [minArea, maxArea]},
     * orders them by area descending (ties keep scan order), truncates to {@code maxRegions}
     * and numbers them 1..N.
     *
     * @param scale factor the mask was downscaled by ({@code 1.0} when analyzed at full
     *              resolution); areas, bounds and centers are reported at the original resolution
     *              and area bounds are interpreted there as well
     */
    public List<Region> extract(BinaryMask mask, RegionKind kind, long minArea, long maxArea, int maxRegions, double scale) {
        if (!(scale > 0.0 && scale <= 1.0)) {
            throw new InvalidInputException("Scale factor must be within (0, 1] (got " + scale + ")");
        }
        return extract(mask, kind, minArea, maxArea, maxRegions,
                originalExtent(mask.width(), scale), originalExtent(mask.height(), scale));
    }

    /**
     * Same as {@link #extract(BinaryMask, RegionKind, long, long, int, double)} for a mask
     * analyzed from an {@code originalWidth x originalHeight} image. Each axis is mapped back
     * with its own factor, so a side that could not shrink any further keeps its extent.
     */
    public List<Region> extract(BinaryMask mask, RegionKind kind, long minArea, long maxArea, int maxRegions,
                                int originalWidth, int originalHeight) {
        if (minArea < 0 || maxArea < minArea) {
            throw new InvalidInputException("Area bounds must satisfy 0 <= min <= max (got [" + minArea + ", " + maxArea + "])");
        }
        if (maxRegions < 0) {
            throw new InvalidInputException("Region cap must not be negative (got " + maxRegions + ")");
        }
        int w = mask.width(), h = mask.height();
        if (originalWidth < w || originalHeight < h) {
            throw new InvalidInputException("Original size " + originalWidth + "x" + originalHeight
                    + " is smaller than the analyzed mask " + w + "x" + h);
        }

        double sx = (double) originalWidth / w;
        double sy = (double) originalHeight / h;
        long limitArea = (long) originalWidth * originalHeight;

        List<Region> kept = new ArrayList<>();
        int[] labels = new int[w * h];
        int[] queue = new int[w * h];
        int nextLabel = 1;
        int components = 0;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (!mask.get(idx) || labels[idx] != 0) continue;

                Stats s = floodFill(mask, labels, queue, x, y, w, h, nextLabel++);
                components++;

                long area = Math.min(Math.round(s.area * sx * sy), limitArea);
                if (area < minArea || area > maxArea) continue;

                int cx = clamp((int) Math.floor((double) s.sumX / s.area * sx), originalWidth - 1);
                int cy = clamp((int) Math.floor((double) s.sumY / s.area * sy), originalHeight - 1);
                BoundingBox bbox = new BoundingBox(
                        clamp((int) Math.floor(s.minX * sx), originalWidth - 1),
                        clamp((int) Math.floor(s.minY * sy), originalHeight - 1),
                        clamp((int) Math.ceil((s.maxX + 1) * sx - 1e-9) - 1, originalWidth - 1),
                        clamp((int) Math.ceil((s.maxY + 1) * sy - 1e-9) - 1, originalHeight - 1));
                kept.add(new Region(0, cx, cy, area, bbox, kind));
            }
        }

        kept.sort(Comparator.comparingLong(Region::areaPixels).reversed());
        int n = Math.min(maxRegions, kept.size());
        List<Region> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(kept.get(i).withId(i + 1));
        }

        log.debug("{} components labeled, {} within [{}, {}], {} returned ({})",
                components, kept.size(), minArea, maxArea, out.size(), kind);
        return out;
    }

    private static int originalExtent(int analyzed, double scale) {
        if (scale == 1.0) return analyzed;
        return (int) Math.ceil(analyzed / scale - 1e-9);
    }

    private static int clamp(int v, int max) {
        return (v < 0) ? 0 : Math.min(max, v);
    }

    private static Stats floodFill(BinaryMask mask, int[] labels, int[] queue, int startX, int startY, int w, int h, int label) {
        int head = 0, tail = 0;
        int start = startY * w + startX;
        queue[tail++] = start;
        labels[start] = label;
        Stats s = new Stats(startX, startY);

        while (head < tail) {
            int p = queue[head++];
            int px = p % w, py = p / w;
            s.add(px, py);

            for (int d = 0; d < 8; d++) {
                int nx = px + DX[d];
                int ny = py + DY[d];
                if (nx >= 0 && nx < w && ny >= 0 && ny < h) {
                    int nIdx = ny * w + nx;
                    if (mask.get(nIdx) && labels[nIdx] == 0) {
                        labels[nIdx] = label;
                        queue[tail++] = nIdx;
                    }
                }
            }
        }
        return s;
    }

    private static final class Stats {
        int area;
        int minX, minY, maxX, maxY;
        long sumX, sumY;

        Stats(int x, int y) {
            minX = maxX = x;
            minY = maxY = y;
        }

        void add(int x, int y) {
            area++;
            sumX += x;
            sumY += y;
            if (x < minX) minX = x;
            if (x > maxX) maxX = x;
            if (y < minY) minY = y;
            if (y > maxY) maxY = y;
        }
    }
}
