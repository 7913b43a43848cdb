package mycompany.heightchange.change;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable set of metric thresholds for one run. Only configured metrics are evaluated.
 */
public final class MetricConfig {

    private final Map<Metric, Double> scalarThresholds;
    private final Map<Metric, PixelThreshold> pixelThresholds;

    private MetricConfig(Builder builder) {
        this.scalarThresholds = Collections.unmodifiableMap(new EnumMap<>(builder.scalarThresholds));
        this.pixelThresholds = Collections.unmodifiableMap(new EnumMap<>(builder.pixelThresholds));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<Metric> getMetrics() {
        EnumSet<Metric> all = EnumSet.noneOf(Metric.class);
        all.addAll(scalarThresholds.keySet());
        all.addAll(pixelThresholds.keySet());
        return Collections.unmodifiableSet(all);
    }

    public boolean isEmpty() {
        return scalarThresholds.isEmpty() && pixelThresholds.isEmpty();
    }

    public double getScalarThreshold(Metric metric) {
        Double threshold = scalarThresholds.get(metric);
        if (threshold == null) {
            throw new IllegalArgumentException("No scalar threshold configured for " + metric);
        }
        return threshold;
    }

    public PixelThreshold getPixelThreshold(Metric metric) {
        PixelThreshold threshold = pixelThresholds.get(metric);
        if (threshold == null) {
            throw new IllegalArgumentException("No pixel threshold configured for " + metric);
        }
        return threshold;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Metric metric : getMetrics()) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(metric).append('=');
            sb.append(metric.isPixelCounting() ? pixelThresholds.get(metric) : scalarThresholds.get(metric));
        }
        return sb.append('}').toString();
    }

    public static final class Builder {
        private final Map<Metric, Double> scalarThresholds = new EnumMap<>(Metric.class);
        private final Map<Metric, PixelThreshold> pixelThresholds = new EnumMap<>(Metric.class);

        private Builder() {
        }

        public Builder mean(double threshold) {
            return scalar(Metric.MEAN, threshold);
        }

        public Builder maxima(double threshold) {
            return scalar(Metric.MAXIMA, threshold);
        }

        public Builder sum(double threshold) {
            return scalar(Metric.SUM, threshold);
        }

        public Builder countLargerThan(double pixelValue, double count) {
            return pixel(Metric.COUNT_LARGER_THAN, new PixelThreshold(pixelValue, count));
        }

        public Builder percentageLargerThan(double pixelValue, double fraction) {
            return pixel(Metric.PERCENTAGE_LARGER_THAN, new PixelThreshold(pixelValue, fraction));
        }

        public Builder scalar(Metric metric, double threshold) {
            if (metric.isPixelCounting()) {
                throw new IllegalArgumentException(metric + " needs a [value, limit] threshold");
            }
            scalarThresholds.put(metric, threshold);
            return this;
        }

        public Builder pixel(Metric metric, PixelThreshold threshold) {
            if (!metric.isPixelCounting()) {
                throw new IllegalArgumentException(metric + " needs a scalar threshold");
            }
            pixelThresholds.put(metric, threshold);
            return this;
        }

        public MetricConfig build() {
            return new MetricConfig(this);
        }
    }
}
