package mycompany.heightchange.raster;

/**
 * Reference and target rasters of a tile do not share a grid. Upstream tiling guarantees
 * identical dimensions, so this aborts the whole run.
 */
public class RasterMismatchException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public RasterMismatchException(String message) {
        super(message);
    }
}
