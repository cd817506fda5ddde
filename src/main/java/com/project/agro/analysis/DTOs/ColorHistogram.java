package com.project.agro.analysis.DTOs;

import java.util.List;

/** Per-channel pixel counts over equal-width bins of [0, 256). */
public record ColorHistogram(int bins, List<Long> red, List<Long> green, List<Long> blue) {

    public ColorHistogram {
        red = List.copyOf(red);
        green = List.copyOf(green);
        blue = List.copyOf(blue);
    }
}
