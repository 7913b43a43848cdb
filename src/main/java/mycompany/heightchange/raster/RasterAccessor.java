package mycompany.heightchange.raster;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Opens height rasters. The caller owns the returned handle and must close it.
 */
public interface RasterAccessor {

    RasterHandle open(Path path) throws IOException;
}
