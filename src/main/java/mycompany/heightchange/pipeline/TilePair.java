package mycompany.heightchange.pipeline;

import java.nio.file.Path;

/**
 * Reference raster of a tile and the target raster it is compared with.
 * The target may not exist.
 */
public class TilePair {
    private final Tile tile;
    private final Path reference;
    private final Path target;

    public TilePair(Tile tile, Path reference, Path target) {
        this.tile = tile;
        this.reference = reference;
        this.target = target;
    }

    public Tile getTile() { return tile; }
    public Path getReference() { return reference; }
    public Path getTarget() { return target; }

    @Override
    public String toString() {
        return tile + " (" + reference + " -> " + target + ")";
    }
}
