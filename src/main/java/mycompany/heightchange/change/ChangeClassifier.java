package mycompany.heightchange.change;

import mycompany.heightchange.raster.DifferenceArray;

import java.util.EnumMap;
import java.util.Map;

/**
 * Decides whether a tile changed by checking its difference array against the configured metrics.
 * All comparisons are strict: a statistic equal to its threshold does not fire.
 */
public class ChangeClassifier {

    private final MetricConfig metrics;

    public ChangeClassifier(MetricConfig metrics) {
        this.metrics = metrics;
    }

    public MetricConfig getMetrics() { return metrics; }

    /**
     * Evaluate every configured metric.
     *
     * @return the verdict, or {@code null} when the target raster had no match
     */
    public ChangeVerdict classify(DifferenceArray diff) {
        if (diff.isNoMatch()) {
            return null;
        }

        DifferenceStats stats = DifferenceStats.of(diff);
        Map<Metric, Boolean> results = new EnumMap<>(Metric.class);
        for (Metric metric : metrics.getMetrics()) {
            results.put(metric, exceeds(metric, diff, stats));
        }
        return new ChangeVerdict(results, stats);
    }

    private boolean exceeds(Metric metric, DifferenceArray diff, DifferenceStats stats) {
        switch (metric) {
            case MEAN:
                return stats.getMean() > metrics.getScalarThreshold(metric);
            case MAXIMA:
                return stats.getMaxima() > metrics.getScalarThreshold(metric);
            case SUM:
                return stats.getSum() > metrics.getScalarThreshold(metric);
            case COUNT_LARGER_THAN: {
                PixelThreshold threshold = metrics.getPixelThreshold(metric);
                return countLargerThan(diff, threshold.getPixelValue()) > threshold.getLimit();
            }
            case PERCENTAGE_LARGER_THAN: {
                PixelThreshold threshold = metrics.getPixelThreshold(metric);
                double fraction = (double) countLargerThan(diff, threshold.getPixelValue()) / stats.getPixelCount();
                return fraction > threshold.getLimit();
            }
            default:
                throw new IllegalArgumentException("Unsupported metric: " + metric);
        }
    }

    /**
     * Count pixels whose difference is strictly above the value
     */
    static long countLargerThan(DifferenceArray diff, double value) {
        long count = 0;
        for (int y = 0; y < diff.getHeight(); y++) {
            for (int x = 0; x < diff.getWidth(); x++) {
                if (diff.get(x, y) > value) count++;
            }
        }
        return count;
    }
}
