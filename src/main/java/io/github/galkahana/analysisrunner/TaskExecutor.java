package io.github.galkahana.analysisrunner;

import io.github.galkahana.analysisrunner.pool.PoolStats;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Common contract of the pooled and inline execution strategies.
 * <p>
 * Futures returned by an executor never complete exceptionally because of a task: handler
 * failures, timeouts and worker crashes are all reported as unsuccessful {@link TaskResult}s.
 *
 * @param <I> Task payload type
 * @param <O> Handler output type
 */
public interface TaskExecutor<I, O> {

    /**
     * Submit a single task.
     *
     * @return Future completed with the task's result
     * @throws IllegalStateException If the executor is not running
     */
    CompletableFuture<TaskResult<O>> submit(Task<I> task);

    /**
     * Submit a batch and invoke {@code onResult} as each task completes.
     *
     * @return Future completed with results index-aligned to {@code tasks}
     * @throws IllegalArgumentException If two tasks share an id
     * @throws IllegalStateException If the executor is not running
     */
    CompletableFuture<List<TaskResult<O>>> process(List<Task<I>> tasks, Consumer<TaskResult<O>> onResult);

    default CompletableFuture<List<TaskResult<O>>> process(List<Task<I>> tasks) {
        return process(tasks, result -> { });
    }

    /**
     * Point-in-time statistics snapshot.
     */
    PoolStats getStats();

    /**
     * Stop accepting work and wait, up to the configured grace period, for running tasks.
     * Blocks until all threads have stopped.
     */
    void shutdown() throws InterruptedException;

    /**
     * Join per-task futures into one future whose list follows the order of {@code futures}.
     */
    static <O> CompletableFuture<List<TaskResult<O>>> inOrder(List<CompletableFuture<TaskResult<O>>> futures) {
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }
}
