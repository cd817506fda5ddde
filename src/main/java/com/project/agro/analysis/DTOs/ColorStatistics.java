package com.project.agro.analysis.DTOs;

public record ColorStatistics(
        ChannelStatistics red,
        ChannelStatistics green,
        ChannelStatistics blue,
        double brightness,
        boolean predominantlyGreen
) {
    public record ChannelStatistics(double mean, double std, int min, int max) {}
}
