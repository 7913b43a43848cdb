package mycompany.heightchange.change;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MetricConfigTest {

    @Test
    void keepsConfiguredThresholds() {
        MetricConfig metrics = MetricConfig.builder().sum(12.0).countLargerThan(0.3, 5).build();

        assertEquals(EnumSet.of(Metric.SUM, Metric.COUNT_LARGER_THAN), metrics.getMetrics());
        assertEquals(12.0, metrics.getScalarThreshold(Metric.SUM), 0.0);
        assertEquals(new PixelThreshold(0.3, 5), metrics.getPixelThreshold(Metric.COUNT_LARGER_THAN));
        assertFalse(metrics.isEmpty());
        assertEquals("{sum=12.0, count_larger_than=[0.3, 5.0]}", metrics.toString());
    }

    @Test
    void rejectsThresholdOfWrongShape() {
        MetricConfig.Builder builder = MetricConfig.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.scalar(Metric.COUNT_LARGER_THAN, 1.0));
        assertThrows(IllegalArgumentException.class, () -> builder.pixel(Metric.MEAN, new PixelThreshold(1, 2)));
    }

    @Test
    void unconfiguredThresholdIsAnError() {
        MetricConfig metrics = MetricConfig.builder().mean(1.0).build();

        assertThrows(IllegalArgumentException.class, () -> metrics.getScalarThreshold(Metric.MAXIMA));
        assertThrows(IllegalArgumentException.class, () -> metrics.getPixelThreshold(Metric.PERCENTAGE_LARGER_THAN));
    }
}
