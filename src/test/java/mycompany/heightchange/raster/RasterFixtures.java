package mycompany.heightchange.raster;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Raster fixtures shared by the tests.
 */
public final class RasterFixtures {

    private RasterFixtures() {
    }

    public static double[][] filled(int width, int height, double value) {
        double[][] band = new double[height][width];
        for (double[] row : band) {
            Arrays.fill(row, value);
        }
        return band;
    }

    public static RasterHandle handle(double[][] band, Double nodata) {
        return new RasterHandle("memory", band, nodata);
    }

    /**
     * Write a single-band 32-bit float GeoTIFF without nodata tag.
     */
    public static Path writeFloatTiff(Path file, double[][] band) throws IOException {
        return writeFloatTiff(file, band, null);
    }

    /**
     * Write a single-band 32-bit float GeoTIFF, tagging it with the GDAL nodata text when given.
     */
    public static Path writeFloatTiff(Path file, double[][] band, String nodata) throws IOException {
        int height = band.length;
        int width = band[0].length;
        FieldType fieldType = FieldType.FLOAT;
        Rasters rasters = new Rasters(width, height, 1, fieldType);
        int rowsPerStrip = rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(fieldType.getBits());
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(1);
        directory.setRowsPerStrip(rowsPerStrip);
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(TiffConstants.SAMPLE_FORMAT_FLOAT);
        directory.setWriteRasters(rasters);
        if (nodata != null) {
            directory.setStringEntryValue(FieldTagType.GDAL_NODATA, nodata);
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rasters.setFirstPixelSample(x, y, (float) band[y][x]);
            }
        }

        TIFFImage tiffImage = new TIFFImage();
        tiffImage.add(directory);
        Files.createDirectories(file.toAbsolutePath().getParent());
        TiffWriter.writeTiff(file.toFile(), tiffImage);
        return file;
    }
}
