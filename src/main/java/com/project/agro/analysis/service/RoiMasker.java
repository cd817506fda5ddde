package com.project.agro.analysis.service;

import com.project.agro.analysis.DTOs.RoiMetadata;
import com.project.agro.analysis.exceptions.InvalidInputException;
import com.project.agro.analysis.imaging.BinaryMask;
import com.project.agro.analysis.imaging.PixelBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.Polygon;
import java.awt.geom.Point2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Restricts analysis to a polygonal area: pixels outside the polygon are zeroed.
 */
@Service
public class RoiMasker {
    private static final Logger log = LoggerFactory.getLogger(RoiMasker.class);

    public record RoiMaskResult(PixelBuffer masked, BinaryMask roi, RoiMetadata metadata) {}

    public RoiMaskResult apply(PixelBuffer buffer, List<Point2D.Double> polygon) {
        if (polygon == null || polygon.size() < 3) {
            throw new InvalidInputException("ROI polygon needs at least 3 points");
        }
        int w = buffer.width(), h = buffer.height();

        Polygon shape = new Polygon();
        for (Point2D.Double p : polygon) {
            shape.addPoint((int) p.x, (int) p.y);
        }

        BufferedImage raster = new BufferedImage(w, h, BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D graphics = raster.createGraphics();
        graphics.setColor(Color.WHITE);
        graphics.fillPolygon(shape);
        graphics.drawPolygon(shape);
        graphics.dispose();

        boolean[] inside = new boolean[w * h];
        byte[] pixels = new byte[w * h];
        raster.getRaster().getDataElements(0, 0, w, h, pixels);
        long area = 0;
        for (int i = 0; i < inside.length; i++) {
            inside[i] = (pixels[i] & 0xFF) > 0;
            if (inside[i]) area++;
        }
        BinaryMask roi = BinaryMask.of(w, h, inside);

        double perimeter = 0.0;
        double xMin = Double.POSITIVE_INFINITY, yMin = Double.POSITIVE_INFINITY;
        double xMax = Double.NEGATIVE_INFINITY, yMax = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < polygon.size(); i++) {
            Point2D.Double a = polygon.get(i);
            Point2D.Double b = polygon.get((i + 1) % polygon.size());
            perimeter += a.distance(b);
            xMin = Math.min(xMin, a.x);
            yMin = Math.min(yMin, a.y);
            xMax = Math.max(xMax, a.x);
            yMax = Math.max(yMax, a.y);
        }

        RoiMetadata metadata = new RoiMetadata(area, Metrics.round(perimeter, 1), xMin, yMin, xMax, yMax,
                Metrics.round(Metrics.percent(area, (long) w * h), 2), w, h, polygon.size());
        log.debug("ROI with {} vertices covers {} pixels ({}%)", polygon.size(), area, metadata.coveragePct());
        return new RoiMaskResult(buffer.masked(roi), roi, metadata);
    }
}
