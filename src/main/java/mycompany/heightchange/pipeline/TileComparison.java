package mycompany.heightchange.pipeline;

import mycompany.heightchange.change.ChangeClassifier;
import mycompany.heightchange.change.ChangeVerdict;
import mycompany.heightchange.raster.DifferenceArray;
import mycompany.heightchange.raster.DifferenceComputer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Compares the rasters of one tile and archives them when it changed.
 * Instances hold no per-tile state and are shared by all workers.
 */
public class TileComparison implements TileTask<TilePair, TileOutcome> {

    private static final Logger LOGGER = LoggerFactory.getLogger(TileComparison.class);

    private final DifferenceComputer differenceComputer;
    private final ChangeClassifier classifier;
    private final ArtifactArchiver archiver;
    private final boolean copyTif;
    private final boolean copyLas;

    public TileComparison(DifferenceComputer differenceComputer, ChangeClassifier classifier,
                          ArtifactArchiver archiver, boolean copyTif, boolean copyLas) {
        this.differenceComputer = differenceComputer;
        this.classifier = classifier;
        this.archiver = archiver;
        this.copyTif = copyTif;
        this.copyLas = copyLas;
    }

    /**
     * Compare one tile.
     *
     * @throws mycompany.heightchange.raster.RasterMismatchException if the rasters do not share a grid
     */
    @Override
    public TileOutcome run(TilePair pair) {
        DifferenceArray difference;
        try {
            difference = differenceComputer.difference(pair.getReference(), pair.getTarget());
        } catch (IOException ex) {
            LOGGER.error("Cannot read rasters of {}: {}", pair.getTile(), ex.getMessage());
            return TileOutcome.failed(pair.getTile(), ex.getMessage());
        }

        ChangeVerdict verdict = classifier.classify(difference);
        if (verdict == null) {
            return TileOutcome.unmatched(pair.getTile());
        }
        if (!verdict.isChanged()) {
            return TileOutcome.unchanged(pair.getTile(), verdict);
        }

        if (copyTif) {
            archiver.archive(pair.getReference(), pair.getTarget(), ArtifactKind.RASTER);
        }
        if (copyLas) {
            archiver.archive(pair.getReference(), pair.getTarget(), ArtifactKind.POINT_CLOUD);
        }
        return TileOutcome.changed(pair.getTile(), verdict);
    }
}
