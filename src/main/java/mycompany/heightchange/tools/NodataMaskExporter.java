package mycompany.heightchange.tools;

import mycompany.heightchange.pipeline.ParallelDispatcher;
import mycompany.heightchange.pipeline.TileEnumerator;
import mycompany.heightchange.raster.NodataMask;
import mycompany.heightchange.raster.RasterAccessor;
import mycompany.heightchange.raster.RasterHandle;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

/**
 * Writes an 8-bit mask image for every raster that contains nodata pixels:
 * 255 where the raster has a measurement, 0 where it has none.
 * Masks are written as TIFF so edges stay sharp.
 */
public class NodataMaskExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodataMaskExporter.class);

    static final int VALID = 255;
    static final int NODATA = 0;

    private final RasterAccessor accessor;
    private final ParallelDispatcher dispatcher;

    public NodataMaskExporter(RasterAccessor accessor, ParallelDispatcher dispatcher) {
        this.accessor = accessor;
        this.dispatcher = dispatcher;
    }

    /**
     * Export masks of all rasters below the input root, mirroring its layout below the output root.
     *
     * @return number of masks written
     */
    public int export(Path inputDir, Path outputDir) throws IOException {
        List<Path> rasters = TileEnumerator.listFiles(inputDir, TileEnumerator.RASTER_EXTENSION);
        AtomicInteger written = new AtomicInteger();
        dispatcher.dispatch(rasters,
                raster -> exportOrSkip(raster, outputDir.resolve(inputDir.relativize(raster))),
                exported -> {
                    if (exported) written.incrementAndGet();
                });
        LOGGER.info("Wrote {} masks for {} rasters", written.get(), rasters.size());
        return written.get();
    }

    private boolean exportOrSkip(Path raster, Path output) {
        try {
            return exportOne(raster, output);
        } catch (IOException ex) {
            LOGGER.error("Cannot export mask of {}: {}", raster, ex.getMessage());
            return false;
        }
    }

    /**
     * Export the mask of one raster.
     *
     * @return false if the raster has no nodata pixels and nothing was written
     */
    boolean exportOne(Path raster, Path output) throws IOException {
        boolean[][] nodata;
        try (RasterHandle handle = accessor.open(raster)) {
            NodataMask mask = NodataMask.of(handle);
            if (!mask.hasNodata()) {
                return false;
            }
            nodata = mask.toArray();
        }

        Files.createDirectories(output.toAbsolutePath().getParent());
        Mat mat = toMat(nodata);
        try {
            if (!imwrite(output.toString(), mat)) {
                throw new IOException("OpenCV could not write mask " + output);
            }
        } finally {
            mat.release();
        }
        LOGGER.debug("Mask written: {}", output);
        return true;
    }

    /**
     * Convert a nodata mask to a single-channel 8-bit Mat
     */
    static Mat toMat(boolean[][] nodata) {
        int height = nodata.length;
        int width = nodata[0].length;
        Mat mat = new Mat(height, width, CV_8UC1);

        byte[] data = new byte[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                data[y * width + x] = (byte) (nodata[y][x] ? NODATA : VALID);
            }
        }
        mat.data().put(data);
        return mat;
    }
}
