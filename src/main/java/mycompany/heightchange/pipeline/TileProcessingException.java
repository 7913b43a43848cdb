package mycompany.heightchange.pipeline;

/**
 * A worker task failed with a checked exception, or the dispatch was interrupted.
 */
public class TileProcessingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TileProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
