package mycompany.heightchange.change;

import java.util.Objects;

/**
 * Threshold of a pixel-counting metric: pixels whose difference exceeds {@code pixelValue}
 * are counted, and the tile changed when that count (or fraction) exceeds {@code limit}.
 */
public final class PixelThreshold {

    private final double pixelValue;
    private final double limit;

    public PixelThreshold(double pixelValue, double limit) {
        this.pixelValue = pixelValue;
        this.limit = limit;
    }

    public double getPixelValue() { return pixelValue; }
    public double getLimit() { return limit; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelThreshold)) return false;
        PixelThreshold that = (PixelThreshold) o;
        return Double.compare(pixelValue, that.pixelValue) == 0 && Double.compare(limit, that.limit) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pixelValue, limit);
    }

    @Override
    public String toString() {
        return "[" + pixelValue + ", " + limit + "]";
    }
}
