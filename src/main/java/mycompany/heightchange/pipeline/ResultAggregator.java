package mycompany.heightchange.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Folds tile outcomes into run counters and the change list.
 * Not thread-safe: feed it from the dispatching thread only.
 * The result does not depend on the order outcomes arrive in.
 */
public class ResultAggregator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultAggregator.class);

    private final List<String> changedStems = new ArrayList<>();
    private int pairs;
    private int changed;
    private int unchanged;
    private int unmatched;
    private int failed;
    private int targetOnly;

    public void accept(TileOutcome outcome) {
        pairs++;
        switch (outcome.getStatus()) {
            case UNMATCHED:
                LOGGER.warn("Non-existing target: {}", outcome.stem());
                unmatched++;
                break;
            case CHANGED:
                LOGGER.debug("Changed {}: {}", outcome.getVerdict(), outcome.stem());
                changedStems.add(outcome.stem());
                changed++;
                break;
            case UNCHANGED:
                LOGGER.debug("Unchanged {}: {}", outcome.getVerdict(), outcome.stem());
                unchanged++;
                break;
            case FAILED:
                LOGGER.error("Failed: {} ({})", outcome.stem(), outcome.getMessage());
                failed++;
                break;
            default:
                throw new IllegalArgumentException("Unexpected outcome: " + outcome);
        }
    }

    /**
     * A tile only the target epoch has; always changed.
     */
    public void acceptTargetOnly(Tile tile) {
        LOGGER.debug("Changed (new): {}", tile.stem());
        changedStems.add(tile.stem());
        targetOnly++;
    }

    /**
     * Current counters without writing anything.
     */
    public RunSummary snapshot() {
        List<String> stems = new ArrayList<>(changedStems);
        Collections.sort(stems);
        return new RunSummary(pairs + targetOnly, changed + targetOnly, unchanged, unmatched, failed,
                targetOnly, stems);
    }

    /**
     * Write the change list, one stem per line, and log the run summary.
     */
    public RunSummary finish(Path changeList) throws IOException {
        RunSummary summary = snapshot();
        Path parent = changeList.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(changeList, StandardCharsets.UTF_8)) {
            for (String stem : summary.getChangedStems()) {
                writer.write(stem);
                writer.write('\n');
            }
        }
        LOGGER.info("New buildings: {}", summary.getTargetOnly());
        if (summary.getUnmatched() > 0 || summary.getFailed() > 0) {
            LOGGER.warn("Unmatched tiles: {}, failed tiles: {}", summary.getUnmatched(), summary.getFailed());
        }
        LOGGER.info("{} / {} has changed.", summary.getChanged(), summary.getTotal());
        return summary;
    }
}
