package mycompany.heightchange.raster;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoTiffRasterAccessorTest {

    @TempDir
    Path tmp;

    private final GeoTiffRasterAccessor accessor = new GeoTiffRasterAccessor();

    @Test
    void readsFloatBand() throws IOException {
        double[][] band = RasterFixtures.filled(4, 3, 1.5);
        band[2][3] = -7.25;
        Path file = RasterFixtures.writeFloatTiff(tmp.resolve("tile.tif"), band);

        try (RasterHandle handle = accessor.open(file)) {
            assertEquals(4, handle.getWidth());
            assertEquals(3, handle.getHeight());
            assertEquals(1.5, handle.getPixel(0, 0), 0.0);
            assertEquals(-7.25, handle.getPixel(3, 2), 0.0);
            assertNull(handle.getNodata());
            assertTrue(handle.getSource().endsWith("tile.tif"));
        }
    }

    @Test
    void readsPlaceholderRaster() throws IOException {
        Path file = RasterFixtures.writeFloatTiff(tmp.resolve("empty.tif"), RasterFixtures.filled(1, 1, 0.0));

        try (RasterHandle handle = accessor.open(file)) {
            assertTrue(handle.isPlaceholder());
        }
    }

    @Test
    void rejectsNonTiffFile() throws IOException {
        Path file = tmp.resolve("broken.tif");
        Files.write(file, "not a raster".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> accessor.open(file));
    }

    @Test
    void rejectsMissingFile() {
        assertThrows(IOException.class, () -> accessor.open(tmp.resolve("missing.tif")));
    }

    @Test
    void readsIntegralNodataTag() throws IOException {
        double[][] band = RasterFixtures.filled(3, 2, 4.0);
        band[1][2] = -9999.0;
        Path file = RasterFixtures.writeFloatTiff(tmp.resolve("tile.tif"), band, "-9999");

        try (RasterHandle handle = accessor.open(file)) {
            assertEquals(-9999.0, handle.getNodata(), 0.0);
            NodataMask mask = NodataMask.of(handle);
            assertTrue(mask.isNodata(2, 1));
            assertEquals(1, mask.countNodata());
        }
    }

    @Test
    void roundsNodataToFloatSamples() throws IOException {
        double[][] band = RasterFixtures.filled(3, 2, 4.0);
        band[0][0] = -9999.9;
        Path file = RasterFixtures.writeFloatTiff(tmp.resolve("tile.tif"), band, "-9999.9");

        try (RasterHandle handle = accessor.open(file)) {
            assertEquals((double) -9999.9f, handle.getNodata(), 0.0);
            assertEquals(handle.getNodata(), handle.getPixel(0, 0), 0.0);
            NodataMask mask = NodataMask.of(handle);
            assertTrue(mask.hasNodata());
            assertTrue(mask.isNodata(0, 0));
            assertEquals(1, mask.countNodata());
        }
    }

    @Test
    void readsNanNodataTag() throws IOException {
        double[][] band = RasterFixtures.filled(2, 2, 4.0);
        band[1][0] = Double.NaN;
        Path file = RasterFixtures.writeFloatTiff(tmp.resolve("tile.tif"), band, "nan");

        try (RasterHandle handle = accessor.open(file)) {
            assertTrue(Double.isNaN(handle.getNodata()));
            assertTrue(NodataMask.of(handle).isNodata(0, 1));
        }
    }

    @Test
    void parsesGdalNodataText() {
        assertEquals(-9999.0, GeoTiffRasterAccessor.parseNodata(" -9999 "), 0.0);
        assertEquals(-3.4028234663852886E38, GeoTiffRasterAccessor.parseNodata("-3.4028234663852886e+38"), 0.0);
        assertTrue(Double.isNaN(GeoTiffRasterAccessor.parseNodata("nan")));
    }
}
