package mycompany.heightchange.raster;

/**
 * A single-band height raster held in memory.
 * The band is indexed {@code [y][x]}; callers only ever see copies of it.
 */
public class RasterHandle implements AutoCloseable {

    private final String source;
    private final int width;
    private final int height;
    private final Double nodata;
    private double[][] band;

    public RasterHandle(String source, double[][] band, Double nodata) {
        if (band.length == 0 || band[0].length == 0) {
            throw new IllegalArgumentException("Raster " + source + " has no pixels");
        }
        this.source = source;
        this.height = band.length;
        this.width = band[0].length;
        this.nodata = nodata;
        this.band = new double[height][];
        for (int y = 0; y < height; y++) {
            if (band[y].length != width) {
                throw new IllegalArgumentException("Raster " + source + " has a ragged row at y=" + y);
            }
            this.band[y] = band[y].clone();
        }
    }

    public String getSource() { return source; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }

    /**
     * Nodata sentinel of the band, or {@code null} when the raster defines none.
     */
    public Double getNodata() { return nodata; }

    public double getPixel(int x, int y) {
        return checkOpen()[y][x];
    }

    /**
     * Copy of the band, safe to modify.
     */
    public double[][] getBand() {
        double[][] open = checkOpen();
        double[][] copy = new double[height][];
        for (int y = 0; y < height; y++) {
            copy[y] = open[y].clone();
        }
        return copy;
    }

    /**
     * The legacy "empty raster" placeholder written by older tiling runs.
     */
    public boolean isPlaceholder() {
        return width == 1 && height == 1;
    }

    public boolean isClosed() {
        return band == null;
    }

    @Override
    public void close() {
        band = null;
    }

    private double[][] checkOpen() {
        if (band == null) {
            throw new IllegalStateException("Raster " + source + " is already closed");
        }
        return band;
    }
}
