package mycompany.heightchange.pipeline;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identity of a tile: its path below the dataset root without extension,
 * e.g. {@code 37EN1/0363100012345678}.
 */
public final class Tile implements Comparable<Tile> {

    private final Path relativePath;

    public Tile(Path relativePath) {
        if (relativePath.isAbsolute()) {
            throw new IllegalArgumentException("Tile path must be relative: " + relativePath);
        }
        this.relativePath = relativePath;
    }

    /**
     * Tile of a file below a root, with the file extension removed.
     */
    public static Tile of(Path root, Path file) {
        Path relative = root.relativize(file);
        return new Tile(relative.resolveSibling(stripExtension(relative.getFileName().toString())));
    }

    public Path getRelativePath() { return relativePath; }

    /** File name without directory or extension; the name written to the change list. */
    public String stem() {
        return relativePath.getFileName().toString();
    }

    /**
     * Path of this tile below a root with an extension such as {@code tif}
     * or {@code reference.tif} appended to the stem.
     */
    public Path resolve(Path root, String extension) {
        return root.resolve(relativePath.resolveSibling(stem() + "." + extension));
    }

    static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    @Override
    public int compareTo(Tile other) {
        return relativePath.compareTo(other.relativePath);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Tile)) return false;
        return relativePath.equals(((Tile) o).relativePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(relativePath);
    }

    @Override
    public String toString() {
        return relativePath.toString();
    }
}
