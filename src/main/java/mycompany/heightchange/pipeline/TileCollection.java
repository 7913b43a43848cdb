package mycompany.heightchange.pipeline;

import java.util.Collections;
import java.util.List;

/**
 * Work list of a run: reference tiles paired with their target, and tiles only the target epoch has.
 */
public class TileCollection {
    private final List<TilePair> pairs;
    private final List<Tile> targetOnly;

    public TileCollection(List<TilePair> pairs, List<Tile> targetOnly) {
        this.pairs = Collections.unmodifiableList(pairs);
        this.targetOnly = Collections.unmodifiableList(targetOnly);
    }

    public List<TilePair> getPairs() { return pairs; }
    public List<Tile> getTargetOnly() { return targetOnly; }
}
