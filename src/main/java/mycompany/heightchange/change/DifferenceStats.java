package mycompany.heightchange.change;

import mycompany.heightchange.raster.DifferenceArray;

/**
 * Summary statistics of a difference array, taken over every pixel.
 */
public class DifferenceStats {
    private final long pixelCount;
    private final double sum;
    private final double mean;
    private final double maxima;

    public DifferenceStats(long pixelCount, double sum, double mean, double maxima) {
        this.pixelCount = pixelCount;
        this.sum = sum;
        this.mean = mean;
        this.maxima = maxima;
    }

    public static DifferenceStats of(DifferenceArray diff) {
        long pixelCount = diff.size();
        double sum = 0.0;
        double maxima = Double.NEGATIVE_INFINITY;
        for (int y = 0; y < diff.getHeight(); y++) {
            for (int x = 0; x < diff.getWidth(); x++) {
                double value = diff.get(x, y);
                sum += value;
                maxima = Math.max(maxima, value);
            }
        }
        return new DifferenceStats(pixelCount, sum, sum / pixelCount, maxima);
    }

    public long getPixelCount() { return pixelCount; }
    public double getSum() { return sum; }
    public double getMean() { return mean; }
    public double getMaxima() { return maxima; }

    @Override
    public String toString() {
        return String.format("mean=%.3f, maxima=%.3f, sum=%.3f, pixels=%d", mean, maxima, sum, pixelCount);
    }
}
