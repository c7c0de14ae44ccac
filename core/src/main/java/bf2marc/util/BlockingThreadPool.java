package bf2marc.util;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;

/**
 * A fixed thread pool where the submitting thread blocks once queueSize tasks are waiting.
 * <p>
 * The intended use is to pace a single producer that creates work faster than can be consumed by the pool,
 * here the list of extracted descriptions. Results are handed back in submission order.
 * <p>
 * Alas, there is no clean way of having a ThreadPoolExecutor with a bounded queue where the caller blocks
 * when the queue is full. Instead, use an unbounded shared queue and a semaphore to put a bound on the
 * number of tasks queued.
 */
public class BlockingThreadPool<T> {
    private final ExecutorService pool;
    private final Semaphore queuePermits;
    private final List<Future<T>> outstandingTasks = new ArrayList<>();

    public BlockingThreadPool(String name, int poolSize) {
        this(name, poolSize, poolSize * 10);
    }

    public BlockingThreadPool(String name, int poolSize, int queueSize) {
        this.queuePermits = new Semaphore(queueSize);
        this.pool = Executors.newFixedThreadPool(poolSize, getThreadFactory(name));
    }

    public void submit(Callable<T> task) {
        queuePermits.acquireUninterruptibly();

        Callable<T> c = () -> {
            try {
                return task.call();
            } finally {
                queuePermits.release();
            }
        };

        outstandingTasks.add(pool.submit(c));
    }

    /**
     * Waits for every submitted task and returns their results in the order they were submitted.
     * A task that threw is reported as an IllegalStateException; callers are expected to submit
     * tasks that do not throw.
     */
    public List<T> awaitAll() throws InterruptedException {
        List<T> results = new ArrayList<>(outstandingTasks.size());
        for (Future<T> f : outstandingTasks) {
            try {
                results.add(f.get());
            } catch (ExecutionException e) {
                throw new IllegalStateException("Task threw exception: " + e.getCause().getMessage(), e.getCause());
            }
        }
        outstandingTasks.clear();
        return results;
    }

    public void cancelAll() {
        outstandingTasks.forEach(t -> t.cancel(true));
        outstandingTasks.clear();
    }

    public void shutdown() {
        pool.shutdown();
    }

    private static ThreadFactory getThreadFactory(String name) {
        return new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d")
                .setDaemon(true)
                .build();
    }
}
