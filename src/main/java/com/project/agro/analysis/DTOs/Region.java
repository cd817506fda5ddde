package com.project.agro.analysis.DTOs;

/**
 * One connected patch: a canopy or a symptom area. Ids follow area-descending extraction
 * order and are only meaningful within the result that holds them.
 */
public record Region(
        int id,
        int centerX,
        int centerY,
        long areaPixels,
        BoundingBox bbox,
        RegionKind kind
) {
    public Region withId(int newId) {
        return new Region(newId, centerX, centerY, areaPixels, bbox, kind);
    }
}
