package mycompany.heightchange.change;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-metric outcome of a tile comparison.
 */
public class ChangeVerdict {
    private final Map<Metric, Boolean> results;
    private final DifferenceStats stats;

    public ChangeVerdict(Map<Metric, Boolean> results, DifferenceStats stats) {
        this.results = Collections.unmodifiableMap(results.isEmpty()
                ? new EnumMap<>(Metric.class) : new EnumMap<>(results));
        this.stats = stats;
    }

    public Map<Metric, Boolean> getResults() { return results; }
    public DifferenceStats getStats() { return stats; }

    /**
     * Whether the given metric exceeded its threshold. Unconfigured metrics never fire.
     */
    public boolean exceeded(Metric metric) {
        return Boolean.TRUE.equals(results.get(metric));
    }

    /**
     * True if any configured metric fired.
     */
    public boolean isChanged() {
        return results.containsValue(Boolean.TRUE);
    }

    @Override
    public String toString() {
        return results.toString();
    }
}
