package mycompany.heightchange.pipeline;

import mycompany.heightchange.change.ChangeVerdict;
import mycompany.heightchange.change.Metric;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResultAggregatorTest {

    @TempDir
    Path tmp;

    private static Tile tile(String name) {
        return Tile.of(Paths.get("/ahn3"), Paths.get("/ahn3/37EN1/" + name + ".tif"));
    }

    private static ChangeVerdict verdict(boolean exceeded) {
        Map<Metric, Boolean> results = new EnumMap<>(Metric.class);
        results.put(Metric.SUM, exceeded);
        return new ChangeVerdict(results, null);
    }

    private static List<TileOutcome> outcomes() {
        return Arrays.asList(
                TileOutcome.changed(tile("b3"), verdict(true)),
                TileOutcome.unchanged(tile("b2"), verdict(false)),
                TileOutcome.unmatched(tile("b4")),
                TileOutcome.changed(tile("b1"), verdict(true)),
                TileOutcome.failed(tile("b5"), "corrupt"));
    }

    @Test
    void countsEveryStatus() {
        ResultAggregator aggregator = new ResultAggregator();
        outcomes().forEach(aggregator::accept);
        aggregator.acceptTargetOnly(tile("b0"));

        RunSummary summary = aggregator.snapshot();

        assertEquals(6, summary.getTotal());
        assertEquals(3, summary.getChanged());
        assertEquals(1, summary.getUnchanged());
        assertEquals(1, summary.getUnmatched());
        assertEquals(1, summary.getFailed());
        assertEquals(1, summary.getTargetOnly());
        assertEquals(Arrays.asList("b0", "b1", "b3"), summary.getChangedStems());
        assertEquals("3 / 6 has changed (new 1, unchanged 1, unmatched 1, failed 1)", summary.toString());
    }

    @Test
    void arrivalOrderDoesNotMatter() {
        ResultAggregator forward = new ResultAggregator();
        outcomes().forEach(forward::accept);

        List<TileOutcome> reversed = outcomes();
        Collections.reverse(reversed);
        ResultAggregator backward = new ResultAggregator();
        reversed.forEach(backward::accept);

        assertEquals(forward.snapshot().toString(), backward.snapshot().toString());
        assertEquals(forward.snapshot().getChangedStems(), backward.snapshot().getChangedStems());
    }

    @Test
    void writesOneStemPerLine() throws IOException {
        ResultAggregator aggregator = new ResultAggregator();
        outcomes().forEach(aggregator::accept);
        aggregator.acceptTargetOnly(tile("b9"));
        Path changeList = tmp.resolve("out/changed.txt");

        aggregator.finish(changeList);

        assertEquals("b1\nb3\nb9\n", new String(Files.readAllBytes(changeList), StandardCharsets.UTF_8));
    }

    @Test
    void emptyRunWritesEmptyList() throws IOException {
        Path changeList = tmp.resolve("changed.txt");

        RunSummary summary = new ResultAggregator().finish(changeList);

        assertEquals(0, summary.getTotal());
        assertEquals(0, Files.size(changeList));
    }
}
