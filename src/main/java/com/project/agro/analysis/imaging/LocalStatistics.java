package com.project.agro.analysis.imaging;

/**
 * Box-window mean and standard deviation of an integer image, via summed-area tables.
 * Windows are clipped at the image border, so edge pixels average over fewer samples.
 */
public final class LocalStatistics {
    private final int width;
    private final int height;
    private final double[] mean;
    private final double[] std;

    private LocalStatistics(int width, int height, double[] mean, double[] std) {
        this.width = width;
        this.height = height;
        this.mean = mean;
        this.std = std;
    }

    public static LocalStatistics of(int[] values, int w, int h, int windowSize) {
        long[] sum = new long[(w + 1) * (h + 1)];
        long[] sumSq = new long[(w + 1) * (h + 1)];
        int stride = w + 1;
        for (int y = 0; y < h; y++) {
            long rowSum = 0, rowSq = 0;
            for (int x = 0; x < w; x++) {
                long v = values[y * w + x];
                rowSum += v;
                rowSq += v * v;
                sum[(y + 1) * stride + x + 1] = sum[y * stride + x + 1] + rowSum;
                sumSq[(y + 1) * stride + x + 1] = sumSq[y * stride + x + 1] + rowSq;
            }
        }

        int half = windowSize / 2;
        double[] mean = new double[w * h];
        double[] std = new double[w * h];
        for (int y = 0; y < h; y++) {
            int y0 = Math.max(0, y - half), y1 = Math.min(h, y + half + 1);
            for (int x = 0; x < w; x++) {
                int x0 = Math.max(0, x - half), x1 = Math.min(w, x + half + 1);
                long count = (long) (x1 - x0) * (y1 - y0);
                long s = sum[y1 * stride + x1] - sum[y0 * stride + x1] - sum[y1 * stride + x0] + sum[y0 * stride + x0];
                long sq = sumSq[y1 * stride + x1] - sumSq[y0 * stride + x1] - sumSq[y1 * stride + x0] + sumSq[y0 * stride + x0];
                // count * sq - s^2 is exact, so a flat window has exactly zero variance
                long spread = count * sq - s * s;
                mean[y * w + x] = (double) s / count;
                std[y * w + x] = spread <= 0 ? 0.0 : Math.sqrt((double) spread) / count;
            }
        }
        return new LocalStatistics(w, h, mean, std);
    }

    public int width() { return width; }

    public int height() { return height; }

    public double mean(int index) { return mean[index]; }

    public double std(int index) { return std[index]; }
}
