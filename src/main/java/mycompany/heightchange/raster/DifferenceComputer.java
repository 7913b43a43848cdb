package mycompany.heightchange.raster;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Computes the nodata-neutral absolute difference between a reference and a target raster.
 */
public class DifferenceComputer {

    private final RasterAccessor accessor;

    public DifferenceComputer(RasterAccessor accessor) {
        this.accessor = accessor;
    }

    /**
     * Difference between the rasters of one tile.
     *
     * @return {@link DifferenceArray#noMatch()} when the target does not exist,
     *         {@link DifferenceArray#placeholder()} when either raster is 1x1,
     *         otherwise the pixel-wise absolute difference
     * @throws RasterMismatchException if the rasters differ in width or height
     */
    public DifferenceArray difference(Path referencePath, Path targetPath) throws IOException {
        if (!Files.isRegularFile(targetPath)) {
            return DifferenceArray.noMatch();
        }

        try (RasterHandle reference = accessor.open(referencePath);
             RasterHandle target = accessor.open(targetPath)) {
            return difference(reference, target);
        }
    }

    /**
     * Difference between two opened rasters. Neither raster is modified.
     */
    public DifferenceArray difference(RasterHandle reference, RasterHandle target) {
        // empty raster from an older tiling stage
        if (reference.isPlaceholder() || target.isPlaceholder()) {
            return DifferenceArray.placeholder();
        }

        if (reference.getWidth() != target.getWidth() || reference.getHeight() != target.getHeight()) {
            throw new RasterMismatchException(String.format(
                    "Rasters must have identical dimensions to compare: %s is %dx%d, %s is %dx%d",
                    reference.getSource(), reference.getWidth(), reference.getHeight(),
                    target.getSource(), target.getWidth(), target.getHeight()));
        }

        NodataMask nodata = NodataMask.of(reference).union(NodataMask.of(target));
        double[][] referenceBand = zeroMasked(reference.getBand(), nodata);
        double[][] targetBand = zeroMasked(target.getBand(), nodata);
        return DifferenceArray.of(absoluteDifference(referenceBand, targetBand));
    }

    /**
     * Zero the masked pixels of a band copy.
     */
    private double[][] zeroMasked(double[][] band, NodataMask mask) {
        if (!mask.hasNodata()) {
            return band;
        }
        for (int y = 0; y < band.length; y++) {
            for (int x = 0; x < band[y].length; x++) {
                if (mask.isNodata(x, y)) {
                    band[y][x] = 0.0;
                }
            }
        }
        return band;
    }

    /**
     * Calculate absolute difference between two bands
     */
    private double[][] absoluteDifference(double[][] reference, double[][] target) {
        int height = reference.length;
        int width = reference[0].length;
        double[][] diff = new double[height][width];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                diff[y][x] = Math.abs(target[y][x] - reference[y][x]);
            }
        }
        return diff;
    }
}
