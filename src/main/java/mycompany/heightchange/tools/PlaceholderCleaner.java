package mycompany.heightchange.tools;

import mycompany.heightchange.pipeline.ParallelDispatcher;
import mycompany.heightchange.pipeline.TileEnumerator;
import mycompany.heightchange.raster.RasterAccessor;
import mycompany.heightchange.raster.RasterHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deletes the 1x1 placeholder rasters older tiling runs wrote for empty tiles.
 */
public class PlaceholderCleaner {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlaceholderCleaner.class);

    private final RasterAccessor accessor;
    private final ParallelDispatcher dispatcher;

    public PlaceholderCleaner(RasterAccessor accessor, ParallelDispatcher dispatcher) {
        this.accessor = accessor;
        this.dispatcher = dispatcher;
    }

    /**
     * @return number of rasters removed
     */
    public int clean(Path inputDir) throws IOException {
        List<Path> rasters = TileEnumerator.listFiles(inputDir, TileEnumerator.RASTER_EXTENSION);
        AtomicInteger removed = new AtomicInteger();
        dispatcher.dispatch(rasters, this::cleanOne, deleted -> {
            if (deleted) removed.incrementAndGet();
        });
        LOGGER.info("Removed {} placeholder rasters out of {}", removed.get(), rasters.size());
        return removed.get();
    }

    /**
     * Delete the raster if it is a placeholder. Unreadable rasters and failed deletions are logged and kept.
     */
    boolean cleanOne(Path raster) {
        try {
            boolean placeholder;
            try (RasterHandle handle = accessor.open(raster)) {
                placeholder = handle.isPlaceholder();
            }
            if (!placeholder) {
                return false;
            }
            Files.delete(raster);
            LOGGER.info("Removed file: {}", raster);
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Cannot clean {}: {}", raster, ex.getMessage());
            return false;
        }
    }
}
