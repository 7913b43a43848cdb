package mycompany.heightchange.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Pairs reference rasters with the target raster at the same relative path.
 */
public class TileEnumerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TileEnumerator.class);

    public static final String RASTER_EXTENSION = "tif";

    private final Path referenceDir;
    private final Path targetDir;

    public TileEnumerator(Path referenceDir, Path targetDir) {
        this.referenceDir = referenceDir;
        this.targetDir = targetDir;
    }

    /**
     * Every reference raster paired with its (possibly missing) target, plus the target rasters
     * no reference points at. Both lists are sorted by relative path.
     */
    public TileCollection enumerate() throws IOException {
        List<TilePair> pairs = new ArrayList<>();
        Set<Path> matchedTargets = new HashSet<>();
        for (Path reference : listRasters(referenceDir)) {
            Tile tile = Tile.of(referenceDir, reference);
            Path target = tile.resolve(targetDir, RASTER_EXTENSION);
            pairs.add(new TilePair(tile, reference, target));
            matchedTargets.add(target.normalize());
        }

        // buildings that only exist in the newer epoch
        List<Tile> targetOnly = new ArrayList<>();
        for (Path target : listRasters(targetDir)) {
            if (!matchedTargets.contains(target.normalize())) {
                targetOnly.add(Tile.of(targetDir, target));
            }
        }

        LOGGER.info("Found {} reference tiles and {} target-only tiles", pairs.size(), targetOnly.size());
        return new TileCollection(pairs, targetOnly);
    }

    /**
     * Regular files below a root ending in {@code .tif}, sorted.
     */
    static List<Path> listRasters(Path root) throws IOException {
        return listFiles(root, RASTER_EXTENSION);
    }

    /**
     * Regular files below a root with the given extension, sorted.
     */
    public static List<Path> listFiles(Path root, String extension) throws IOException {
        String suffix = "." + extension;
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(suffix))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
