package mycompany.heightchange.raster;

/**
 * Pixel-wise absolute height difference between the reference and target raster of a tile.
 */
public final class DifferenceArray {

    public enum Kind {
        /** The target raster does not exist. */
        NO_MATCH,
        /** One of the rasters is the legacy 1x1 placeholder; carries a single zero. */
        PLACEHOLDER,
        GRID
    }

    private static final DifferenceArray NO_MATCH = new DifferenceArray(Kind.NO_MATCH, null);
    private static final DifferenceArray PLACEHOLDER = new DifferenceArray(Kind.PLACEHOLDER, new double[][]{{0.0}});

    private final Kind kind;
    private final double[][] values;

    private DifferenceArray(Kind kind, double[][] values) {
        this.kind = kind;
        this.values = values;
    }

    public static DifferenceArray noMatch() {
        return NO_MATCH;
    }

    public static DifferenceArray placeholder() {
        return PLACEHOLDER;
    }

    /**
     * Wraps a difference grid indexed {@code [y][x]}. The grid is taken over, not copied.
     */
    static DifferenceArray of(double[][] values) {
        return new DifferenceArray(Kind.GRID, values);
    }

    public Kind getKind() { return kind; }

    public boolean isNoMatch() {
        return kind == Kind.NO_MATCH;
    }

    public boolean isPlaceholder() {
        return kind == Kind.PLACEHOLDER;
    }

    public int getWidth() {
        return values == null ? 0 : values[0].length;
    }

    public int getHeight() {
        return values == null ? 0 : values.length;
    }

    public long size() {
        return (long) getWidth() * getHeight();
    }

    public double get(int x, int y) {
        if (values == null) {
            throw new IllegalStateException("No difference values without a matching target");
        }
        return values[y][x];
    }
}
