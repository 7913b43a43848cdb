package mycompany.heightchange.pipeline;

import java.util.Collections;
import java.util.List;

/**
 * Counters and change list of a finished run.
 */
public class RunSummary {
    private final int total;
    private final int changed;
    private final int unchanged;
    private final int unmatched;
    private final int failed;
    private final int targetOnly;
    private final List<String> changedStems;

    public RunSummary(int total, int changed, int unchanged, int unmatched, int failed, int targetOnly,
                      List<String> changedStems) {
        this.total = total;
        this.changed = changed;
        this.unchanged = unchanged;
        this.unmatched = unmatched;
        this.failed = failed;
        this.targetOnly = targetOnly;
        this.changedStems = Collections.unmodifiableList(changedStems);
    }

    /**
     * Tiles considered: compared pairs plus target-only tiles. Older runs logged the
     * changed count against the reference tiles only, so their totals are lower.
     */
    public int getTotal() { return total; }

    /** Tiles changed by a metric plus target-only tiles. */
    public int getChanged() { return changed; }
    public int getUnchanged() { return unchanged; }
    public int getUnmatched() { return unmatched; }
    public int getFailed() { return failed; }
    public int getTargetOnly() { return targetOnly; }

    /** Stems of all changed tiles, sorted. */
    public List<String> getChangedStems() { return changedStems; }

    @Override
    public String toString() {
        return String.format("%d / %d has changed (new %d, unchanged %d, unmatched %d, failed %d)",
                changed, total, targetOnly, unchanged, unmatched, failed);
    }
}
