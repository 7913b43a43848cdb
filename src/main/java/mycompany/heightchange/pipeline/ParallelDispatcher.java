package mycompany.heightchange.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs a task over a list of items on a fixed-size worker pool. Results are handed to the
 * sink on the calling thread in completion order, so the sink needs no synchronization.
 * A task that throws aborts the whole dispatch.
 */
public class ParallelDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ParallelDispatcher.class);

    private static final int PROGRESS_STEPS = 10;

    private final int threads;

    /**
     * @param threads pool size; 0 or less uses one worker per available processor
     */
    public ParallelDispatcher(int threads) {
        this.threads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    public int getThreads() { return threads; }

    /**
     * Run the task for every item and block until all results reached the sink.
     *
     * @throws RuntimeException the unchecked exception a task failed with
     * @throws TileProcessingException if a task failed with a checked exception or the caller was interrupted
     */
    public <T, R> void dispatch(List<T> items, TileTask<T, R> task, Consumer<R> sink) {
        if (items.isEmpty()) {
            return;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, items.size()), new WorkerFactory());
        CompletionService<R> completion = new ExecutorCompletionService<>(pool);
        List<Future<R>> futures = new ArrayList<>(items.size());
        try {
            for (T item : items) {
                futures.add(completion.submit(() -> task.run(item)));
            }

            int total = items.size();
            int step = Math.max(1, total / PROGRESS_STEPS);
            for (int done = 1; done <= total; done++) {
                sink.accept(completion.take().get());
                if (done % step == 0 || done == total) {
                    LOGGER.info("Processed {} / {}", done, total);
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TileProcessingException("Interrupted while waiting for workers", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new TileProcessingException("Worker failed: " + cause.getMessage(), cause);
        } finally {
            // no-op for finished tasks
            for (Future<R> future : futures) {
                future.cancel(true);
            }
            pool.shutdownNow();
        }
    }

    private static final class WorkerFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger worker = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "tile-worker-" + pool + "-" + worker.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
