package mycompany.heightchange.pipeline;

/**
 * Files archived for a changed tile.
 */
public enum ArtifactKind {
    RASTER("tif"),
    POINT_CLOUD("las");

    private final String extension;

    ArtifactKind(String extension) {
        this.extension = extension;
    }

    public String getExtension() { return extension; }
}
