package mycompany.heightchange.raster;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NodataMaskTest {

    @Test
    void withoutNodataValueMaskIsEmpty() {
        double[][] band = RasterFixtures.filled(3, 2, -9999.0);
        NodataMask mask = NodataMask.of(RasterFixtures.handle(band, null));

        assertFalse(mask.hasNodata());
        assertEquals(0, mask.countNodata());
        assertEquals(3, mask.getWidth());
        assertEquals(2, mask.getHeight());
    }

    @Test
    void nodataValueThatDoesNotOccurIsNotReported() {
        NodataMask mask = NodataMask.of(RasterFixtures.handle(RasterFixtures.filled(4, 4, 1.0), -9999.0));

        assertFalse(mask.hasNodata());
        assertEquals(0, mask.countNodata());
    }

    @Test
    void marksEveryNodataPixel() {
        double[][] band = RasterFixtures.filled(3, 3, 2.5);
        band[0][1] = -9999.0;
        band[2][2] = -9999.0;

        NodataMask mask = NodataMask.of(RasterFixtures.handle(band, -9999.0));

        assertTrue(mask.hasNodata());
        assertEquals(2, mask.countNodata());
        assertTrue(mask.isNodata(1, 0));
        assertTrue(mask.isNodata(2, 2));
        assertFalse(mask.isNodata(0, 0));
    }

    @Test
    void nanSentinelMatchesNanPixels() {
        double[][] band = RasterFixtures.filled(2, 2, 1.0);
        band[1][0] = Double.NaN;

        NodataMask mask = NodataMask.of(RasterFixtures.handle(band, Double.NaN));

        assertTrue(mask.hasNodata());
        assertTrue(mask.isNodata(0, 1));
        assertEquals(1, mask.countNodata());
    }

    @Test
    void unionCombinesBothMasks() {
        double[][] reference = RasterFixtures.filled(2, 2, 1.0);
        reference[0][0] = -1.0;
        double[][] target = RasterFixtures.filled(2, 2, 1.0);
        target[1][1] = -2.0;

        NodataMask union = NodataMask.of(RasterFixtures.handle(reference, -1.0))
                .union(NodataMask.of(RasterFixtures.handle(target, -2.0)));

        assertTrue(union.hasNodata());
        assertTrue(union.isNodata(0, 0));
        assertTrue(union.isNodata(1, 1));
        assertEquals(2, union.countNodata());
    }

    @Test
    void unionRejectsDifferentShapes() {
        NodataMask small = NodataMask.of(RasterFixtures.handle(RasterFixtures.filled(2, 2, 0.0), null));
        NodataMask large = NodataMask.of(RasterFixtures.handle(RasterFixtures.filled(3, 2, 0.0), null));

        assertThrows(IllegalArgumentException.class, () -> small.union(large));
    }
}
