package mycompany.heightchange.pipeline;

import mycompany.heightchange.config.CompareConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies the reference and target files of a changed tile into an inspection tree that
 * mirrors the reference layout: {@code <save>/<tile>.reference.<ext>} and {@code <save>/<tile>.target.<ext>}.
 * Copy failures are logged and never propagate.
 */
public class ArtifactArchiver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactArchiver.class);

    private final Path referenceDir;
    private final Path saveDir;
    private final Path referenceLasDir;
    private final Path targetLasDir;
    private final Path saveLasDir;

    public ArtifactArchiver(Path referenceDir, Path saveDir, Path referenceLasDir, Path targetLasDir, Path saveLasDir) {
        this.referenceDir = referenceDir;
        this.saveDir = saveDir;
        this.referenceLasDir = referenceLasDir;
        this.targetLasDir = targetLasDir;
        this.saveLasDir = saveLasDir;
    }

    public static ArtifactArchiver fromConfig(CompareConfig config) {
        return new ArtifactArchiver(config.getReferenceDir(), config.getSaveDir(),
                config.getReferenceLasDir(), config.getTargetLasDir(), config.getSaveLasDir());
    }

    /**
     * Archive one kind of artifact of the tile whose reference raster is given.
     *
     * @return true if both files were copied
     * @throws IllegalArgumentException if the kind is missing
     * @throws IllegalStateException if no destination is configured for the kind
     */
    public boolean archive(Path referencePath, Path targetPath, ArtifactKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Artifact kind must be tif or las, got null");
        }
        Tile tile = Tile.of(referenceDir, referencePath);

        Path referenceSource;
        Path targetSource;
        Path destination;
        switch (kind) {
            case RASTER:
                referenceSource = referencePath;
                targetSource = targetPath;
                destination = require(saveDir, "save_dir");
                break;
            case POINT_CLOUD:
                referenceSource = tile.resolve(require(referenceLasDir, "reference_las_dir"), kind.getExtension());
                targetSource = tile.resolve(require(targetLasDir, "target_las_dir"), kind.getExtension());
                destination = require(saveLasDir, "save_las_dir");
                break;
            default:
                throw new IllegalArgumentException("Unsupported artifact kind: " + kind);
        }

        Path referenceCopy = tile.resolve(destination, "reference." + kind.getExtension());
        Path targetCopy = tile.resolve(destination, "target." + kind.getExtension());
        try {
            Files.createDirectories(referenceCopy.getParent());
            return copy(referenceSource, referenceCopy) && copy(targetSource, targetCopy);
        } catch (IOException ex) {
            LOGGER.error("Cannot create archive directory for {}: {}", tile, ex.getMessage());
            return false;
        }
    }

    private boolean copy(Path source, Path destination) {
        try {
            if (Files.isDirectory(destination)) {
                LOGGER.error("Destination is a directory: {}", destination);
                return false;
            }
            if (Files.exists(destination) && Files.isSameFile(source, destination)) {
                LOGGER.error("Source and destination represent the same file: {}", source);
                return false;
            }
            Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (AccessDeniedException ex) {
            LOGGER.error("Permission denied: {}", ex.getFile());
        } catch (NoSuchFileException ex) {
            LOGGER.error("Missing file to archive: {}", ex.getFile());
        } catch (IOException ex) {
            LOGGER.error("Failed to copy {} to {}", source, destination, ex);
        }
        return false;
    }

    private static Path require(Path dir, String key) {
        if (dir == null) {
            throw new IllegalStateException(key + " is not configured");
        }
        return dir;
    }
}
