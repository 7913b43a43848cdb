package mycompany.heightchange.pipeline;

import mycompany.heightchange.change.ChangeClassifier;
import mycompany.heightchange.config.CompareConfig;
import mycompany.heightchange.raster.DifferenceComputer;
import mycompany.heightchange.raster.GeoTiffRasterAccessor;
import mycompany.heightchange.raster.RasterAccessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * One comparison of a reference dataset against a target dataset.
 */
public class ChangeDetectionRun {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChangeDetectionRun.class);

    private final CompareConfig config;
    private final RasterAccessor accessor;

    public ChangeDetectionRun(CompareConfig config) {
        this(config, new GeoTiffRasterAccessor());
    }

    public ChangeDetectionRun(CompareConfig config, RasterAccessor accessor) {
        this.config = config;
        this.accessor = accessor;
    }

    /**
     * Compare all tiles and write the change list.
     *
     * @throws mycompany.heightchange.raster.RasterMismatchException if any tile's rasters do not share a grid
     */
    public RunSummary execute() throws IOException {
        TileCollection tiles = new TileEnumerator(config.getReferenceDir(), config.getTargetDir()).enumerate();

        TileComparison comparison = new TileComparison(
                new DifferenceComputer(accessor),
                new ChangeClassifier(config.getMetrics()),
                ArtifactArchiver.fromConfig(config),
                config.isCopyTif(),
                config.isCopyLas());

        ParallelDispatcher dispatcher = new ParallelDispatcher(config.getEffectiveThreads());
        LOGGER.info("Comparing {} tiles on {} workers", tiles.getPairs().size(), dispatcher.getThreads());

        ResultAggregator aggregator = new ResultAggregator();
        dispatcher.dispatch(tiles.getPairs(), comparison, aggregator::accept);
        for (Tile tile : tiles.getTargetOnly()) {
            aggregator.acceptTargetOnly(tile);
        }
        return aggregator.finish(config.getChangeList());
    }
}
