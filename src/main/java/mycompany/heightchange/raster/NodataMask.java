package mycompany.heightchange.raster;

/**
 * Boolean mask of the nodata pixels of a raster, indexed {@code [y][x]}.
 */
public final class NodataMask {

    private final boolean[][] mask;
    private final boolean hasNodata;

    private NodataMask(boolean[][] mask, boolean hasNodata) {
        this.mask = mask;
        this.hasNodata = hasNodata;
    }

    /**
     * Mask the pixels equal to the raster's nodata value. A NaN sentinel matches NaN pixels.
     * Without a nodata value the mask is all false.
     */
    public static NodataMask of(RasterHandle raster) {
        int width = raster.getWidth();
        int height = raster.getHeight();
        boolean[][] mask = new boolean[height][width];
        Double nodata = raster.getNodata();
        if (nodata == null) {
            return new NodataMask(mask, false);
        }

        double sentinel = nodata;
        boolean found = false;
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double value = raster.getPixel(x, y);
                // == alone misses NaN sentinels
                if (value == sentinel || (Double.isNaN(sentinel) && Double.isNaN(value))) {
                    mask[y][x] = true;
                    found = true;
                }
            }
        }
        return new NodataMask(mask, found);
    }

    /**
     * Pixels that are nodata in either mask. Both masks must have the same shape.
     */
    public NodataMask union(NodataMask other) {
        if (getWidth() != other.getWidth() || getHeight() != other.getHeight()) {
            throw new IllegalArgumentException("Cannot union masks of different shape");
        }
        boolean[][] result = new boolean[getHeight()][getWidth()];
        for (int y = 0; y < result.length; y++) {
            for (int x = 0; x < result[y].length; x++) {
                result[y][x] = mask[y][x] || other.mask[y][x];
            }
        }
        return new NodataMask(result, hasNodata || other.hasNodata);
    }

    public boolean hasNodata() { return hasNodata; }
    public int getWidth() { return mask[0].length; }
    public int getHeight() { return mask.length; }

    public boolean isNodata(int x, int y) {
        return mask[y][x];
    }

    public int countNodata() {
        int count = 0;
        for (boolean[] row : mask) {
            for (boolean pixel : row) {
                if (pixel) count++;
            }
        }
        return count;
    }

    public boolean[][] toArray() {
        boolean[][] copy = new boolean[mask.length][];
        for (int y = 0; y < mask.length; y++) {
            copy[y] = mask[y].clone();
        }
        return copy;
    }
}
