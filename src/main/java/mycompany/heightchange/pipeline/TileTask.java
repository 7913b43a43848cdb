package mycompany.heightchange.pipeline;

/**
 * Work done for one item by a pool worker.
 */
@FunctionalInterface
public interface TileTask<T, R> {

    R run(T item) throws Exception;
}
