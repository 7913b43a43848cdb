package mycompany.heightchange.pipeline;

import mycompany.heightchange.change.ChangeVerdict;

/**
 * Terminal result of comparing one tile.
 */
public final class TileOutcome {

    public enum Status {
        /** The target raster does not exist. */
        UNMATCHED,
        UNCHANGED,
        CHANGED,
        /** A raster of the tile could not be read. */
        FAILED
    }

    private final Tile tile;
    private final Status status;
    private final ChangeVerdict verdict;
    private final String message;

    private TileOutcome(Tile tile, Status status, ChangeVerdict verdict, String message) {
        this.tile = tile;
        this.status = status;
        this.verdict = verdict;
        this.message = message;
    }

    public static TileOutcome unmatched(Tile tile) {
        return new TileOutcome(tile, Status.UNMATCHED, null, null);
    }

    public static TileOutcome unchanged(Tile tile, ChangeVerdict verdict) {
        return new TileOutcome(tile, Status.UNCHANGED, verdict, null);
    }

    public static TileOutcome changed(Tile tile, ChangeVerdict verdict) {
        return new TileOutcome(tile, Status.CHANGED, verdict, null);
    }

    public static TileOutcome failed(Tile tile, String message) {
        return new TileOutcome(tile, Status.FAILED, null, message);
    }

    public Tile getTile() { return tile; }
    public Status getStatus() { return status; }

    /** Metric results; {@code null} for unmatched and failed tiles. */
    public ChangeVerdict getVerdict() { return verdict; }

    /** Failure reason of a {@link Status#FAILED} tile. */
    public String getMessage() { return message; }

    public String stem() {
        return tile.stem();
    }

    @Override
    public String toString() {
        return status + " " + tile + (verdict != null ? " " + verdict : "");
    }
}
