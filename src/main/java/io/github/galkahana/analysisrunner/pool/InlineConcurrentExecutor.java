package io.github.galkahana.analysisrunner.pool;

import io.github.galkahana.analysisrunner.HandlerRegistry;
import io.github.galkahana.analysisrunner.Task;
import io.github.galkahana.analysisrunner.TaskExecutor;
import io.github.galkahana.analysisrunner.TaskResult;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.IntStream;
import lombok.extern.slf4j.Slf4j;

/**
 * Pool-less executor with the same contract as {@link WorkerPool}.
 * <p>
 * Tasks run on a shared in-process thread pool fed from a priority queue. Any exception or error
 * thrown by a handler becomes a failed result. There is no timeout enforcement and no crash
 * containment: a handler that blocks holds its thread until it returns.
 *
 * @param <I> Task payload type
 * @param <O> Handler output type
 */
@Slf4j
public class InlineConcurrentExecutor<I, O> implements TaskExecutor<I, O> {

    private final WorkerPoolConfig config;
    private final TaskRunner<I, O> runner;
    private final ThreadPoolExecutor executor;
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicInteger activeTasks = new AtomicInteger(0);
    private final AtomicLong tasksProcessed = new AtomicLong(0);

    private volatile boolean running = true;

    /**
     * Queue entry ordered by priority (higher first), then submission order.
     */
    private final class QueuedTask implements Runnable, Comparable<QueuedTask> {
        private final Task<I> task;
        private final CompletableFuture<TaskResult<O>> future = new CompletableFuture<>();
        private final long order = sequence.getAndIncrement();

        QueuedTask(Task<I> task) {
            this.task = task;
        }

        @Override
        public void run() {
            activeTasks.incrementAndGet();
            long start = System.nanoTime();
            TaskResult<O> result;
            try {
                result = runner.run(task, TaskResult.NO_WORKER_ID);
            } catch (InterruptedException e) {
                log.warn("Task {} interrupted", task.id());
                Thread.currentThread().interrupt();
                result = TaskResult.failure(task.id(), "Task interrupted", TaskResult.NO_WORKER_ID,
                        TaskRunner.elapsedMs(start));
            } catch (Throwable t) {
                log.error("Task {} failed with an unrecoverable error", task.id(), t);
                result = TaskResult.failure(task.id(), t, TaskResult.NO_WORKER_ID, TaskRunner.elapsedMs(start));
            } finally {
                activeTasks.decrementAndGet();
                tasksProcessed.incrementAndGet();
            }
            // Counters are settled before the caller can observe the result
            future.complete(result);
        }

        void discard() {
            future.complete(TaskResult.failure(task.id(), "Task discarded: executor shut down",
                    TaskResult.NO_WORKER_ID, 0));
        }

        @Override
        public int compareTo(QueuedTask other) {
            int byPriority = Integer.compare(other.task.priority(), task.priority());
            return byPriority != 0 ? byPriority : Long.compare(order, other.order);
        }
    }

    public InlineConcurrentExecutor(WorkerPoolConfig config, HandlerRegistry<I, O> handlers) {
        this.config = config;
        this.runner = new TaskRunner<>(handlers);

        AtomicInteger threadCounter = new AtomicInteger(0);
        this.executor = new ThreadPoolExecutor(config.maxWorkers(), config.maxWorkers(), 0L, TimeUnit.MILLISECONDS,
                new PriorityBlockingQueue<>(), runnable -> {
                    Thread thread = new Thread(runnable, "inline-" + threadCounter.getAndIncrement());
                    thread.setDaemon(true);
                    return thread;
                });
        // Every task goes through the priority queue instead of straight to a new thread
        this.executor.prestartAllCoreThreads();

        log.info("Started inline executor with {} threads", config.maxWorkers());
    }

    @Override
    public CompletableFuture<TaskResult<O>> submit(Task<I> task) {
        if (!running) throw new IllegalStateException("Inline executor has been shut down");
        QueuedTask queued = new QueuedTask(task);
        try {
            executor.execute(queued);
        } catch (RejectedExecutionException e) {
            queued.discard();
        }
        return queued.future;
    }

    @Override
    public CompletableFuture<List<TaskResult<O>>> process(List<Task<I>> tasks, Consumer<TaskResult<O>> onResult) {
        Task.requireUniqueIds(tasks);
        if (!running) throw new IllegalStateException("Inline executor has been shut down");
        if (tasks.isEmpty()) return CompletableFuture.completedFuture(List.of());

        // Submit higher priorities first so idle threads pick them up before the rest arrive
        List<CompletableFuture<TaskResult<O>>> futures = new ArrayList<>(Collections.nCopies(tasks.size(), null));
        IntStream.range(0, tasks.size())
                .boxed()
                .sorted(Comparator.comparingInt((Integer i) -> tasks.get(i).priority()).reversed())
                .forEach(i -> futures.set(i, submit(tasks.get(i)).thenApply(result -> {
                    try {
                        onResult.accept(result);
                    } catch (RuntimeException e) {
                        log.warn("Result callback failed for task {}", result.taskId(), e);
                    }
                    return result;
                })));

        return TaskExecutor.inOrder(futures);
    }

    @Override
    public PoolStats getStats() {
        if (!running && executor.isTerminated()) {
            return new PoolStats(0, 0, 0, 0, 0, tasksProcessed.get(), 0, 0.0, 0);
        }
        int total = config.maxWorkers();
        int busy = Math.min(activeTasks.get(), total);
        return new PoolStats(total, total - busy, busy, executor.getQueue().size(), busy, tasksProcessed.get(), 0,
                PoolStats.utilization(busy, total), PoolStats.heapUsedMB());
    }

    /**
     * Discard queued tasks, wait up to the grace period for running ones, then interrupt them.
     */
    @Override
    public synchronized void shutdown() throws InterruptedException {
        if (!running) return;
        log.info("Shutdown requested");
        running = false;

        List<Runnable> pending = new ArrayList<>();
        executor.getQueue().drainTo(pending);
        pending.forEach(runnable -> ((QueuedTask) runnable).discard());
        if (!pending.isEmpty()) log.info("Discarded {} pending tasks", pending.size());

        executor.shutdown();
        if (!executor.awaitTermination(config.shutdownGraceMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Running tasks did not finish within {}ms - interrupting", config.shutdownGraceMs());
            executor.shutdownNow();
        }
        log.info("Inline executor stopped. Stats: processed={}", tasksProcessed.get());
    }
}
