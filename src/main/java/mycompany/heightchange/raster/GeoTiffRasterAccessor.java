package mycompany.heightchange.raster;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the first band of a GeoTIFF height raster.
 */
public class GeoTiffRasterAccessor implements RasterAccessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeoTiffRasterAccessor.class);

    @Override
    public RasterHandle open(Path path) throws IOException {
        TIFFImage tiff;
        try {
            tiff = TiffReader.readTiff(path.toFile());
        } catch (TiffException ex) {
            throw new IOException("Unreadable raster " + path + ": " + ex.getMessage(), ex);
        }
        if (tiff.getFileDirectories().isEmpty()) {
            throw new IOException("Raster " + path + " has no image directory");
        }

        FileDirectory directory = tiff.getFileDirectory();
        Rasters rasters;
        try {
            rasters = directory.readRasters();
        } catch (TiffException ex) {
            throw new IOException("Unreadable pixels in " + path + ": " + ex.getMessage(), ex);
        }

        int width = rasters.getWidth();
        int height = rasters.getHeight();
        double[][] band = new double[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                band[y][x] = rasters.getFirstPixelSample(x, y).doubleValue();
            }
        }

        Double nodata = readNodata(directory, path);
        if (nodata != null && directory.getFieldTypeForSample(0) == FieldType.FLOAT) {
            // float32 pixels only match a sentinel rounded the same way
            nodata = (double) nodata.floatValue();
        }
        return new RasterHandle(path.toString(), band, nodata);
    }

    /**
     * Value of the GDAL_NODATA ASCII tag, or {@code null} if the tag is absent or malformed.
     */
    private static Double readNodata(FileDirectory directory, Path path) {
        String text = directory.getStringEntryValue(FieldTagType.GDAL_NODATA);
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return parseNodata(text);
        } catch (NumberFormatException ex) {
            LOGGER.warn("Ignoring malformed nodata value '{}' in {}", text.trim(), path);
            return null;
        }
    }

    static Double parseNodata(String text) {
        String value = text.trim();
        if (value.equalsIgnoreCase("nan")) {
            return Double.NaN;
        }
        return Double.valueOf(value);
    }
}
