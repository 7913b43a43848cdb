package mycompany.heightchange.change;

/**
 * Statistical tests a difference array can be checked against.
 */
public enum Metric {
    MEAN("mean", false),
    MAXIMA("maxima", false),
    SUM("sum", false),
    /** Number of pixels above a height difference. */
    COUNT_LARGER_THAN("count_larger_than", true),
    /** Fraction of pixels above a height difference. */
    PERCENTAGE_LARGER_THAN("percentage_larger_than", true);

    private final String key;
    private final boolean pixelCounting;

    Metric(String key, boolean pixelCounting) {
        this.key = key;
        this.pixelCounting = pixelCounting;
    }

    /** Name used in configuration files and logs. */
    public String getKey() { return key; }

    /** Whether the threshold is a (pixel value, limit) pair rather than a scalar. */
    public boolean isPixelCounting() { return pixelCounting; }

    @Override
    public String toString() {
        return key;
    }
}
