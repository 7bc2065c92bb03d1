package io.github.galkahana.analysisrunner.pool;

import io.github.galkahana.analysisrunner.HandlerRegistry;
import io.github.galkahana.analysisrunner.Task;
import io.github.galkahana.analysisrunner.TaskExecutor;
import io.github.galkahana.analysisrunner.TaskResult;
import io.github.galkahana.analysisrunner.TaskTimeoutException;
import io.github.galkahana.analysisrunner.WorkerCrashException;
import io.github.galkahana.analysisrunner.WorkerInitException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-size pool of isolated workers with timeout enforcement, crash recovery and graceful shutdown.
 * <p>
 * Every mutation of the queue and of worker assignments runs as an event on a single dispatcher
 * thread, which also hosts the per-task timeout timers. Workers and callers only ever post events,
 * so a task can never be handed to two workers.
 * <p>
 * If workers cannot be started, the pool logs a warning and delegates every call to an
 * {@link InlineConcurrentExecutor} built from the same configuration.
 *
 * @param <I> Task payload type
 * @param <O> Handler output type
 */
@Slf4j
public class WorkerPool<I, O> implements TaskExecutor<I, O> {

    private enum State { NEW, RUNNING, DISABLED, SHUTTING_DOWN, TERMINATED }

    private static final long RESPAWN_BACKOFF_MS = 100;
    private static final long DISPATCHER_STOP_TIMEOUT_MS = 5_000;
    private static final AtomicInteger POOL_COUNTER = new AtomicInteger(0);

    private final WorkerPoolConfig config;
    private final HandlerRegistry<I, O> handlers;
    private final TaskRunner<I, O> runner;
    private final ThreadFactory workerThreads;
    private final ScheduledThreadPoolExecutor dispatcher;
    private final List<PoolListener> listeners = new CopyOnWriteArrayList<>();
    private final Worker.Callbacks<I, O> workerCallbacks = new Worker.Callbacks<>() {
        @Override
        public void ready(Worker<I, O> worker) {
            onDispatcher(() -> workerReady(worker));
        }

        @Override
        public void completed(Worker<I, O> worker, TaskResult<O> result) {
            onDispatcher(() -> taskCompleted(worker, result));
        }
    };

    private volatile State state = State.NEW;
    private volatile Thread dispatcherThread;
    private volatile InlineConcurrentExecutor<I, O> fallback;

    // Confined to the dispatcher thread
    private final TaskQueue<PendingTask<I, O>> queue = new TaskQueue<>(PendingTask::priority);
    private final List<Slot<I, O>> slots = new ArrayList<>();
    private final CompletableFuture<Void> readySignal = new CompletableFuture<>();
    private CompletableFuture<Void> drainedSignal;
    private long totalTasksProcessed = 0;
    private int restarts = 0;

    /**
     * Worker slot. The worker object changes on every restart; the id does not.
     */
    private static final class Slot<I, O> {
        final int id;
        Worker<I, O> worker;
        WorkerStatus status = WorkerStatus.RESTARTING;
        PendingTask<I, O> current;
        ScheduledFuture<?> timeout;
        int tasksCompleted;

        Slot(int id) {
            this.id = id;
        }
    }

    private static final class PendingTask<I, O> {
        final Task<I> task;
        final CompletableFuture<TaskResult<O>> future = new CompletableFuture<>();
        long startNanos;

        PendingTask(Task<I> task) {
            this.task = task;
        }

        int priority() {
            return task.priority();
        }

        long elapsedMs() {
            return startNanos == 0 ? 0 : TaskRunner.elapsedMs(startNanos);
        }
    }

    public WorkerPool(WorkerPoolConfig config, HandlerRegistry<I, O> handlers) {
        this(config, handlers, defaultWorkerThreads());
    }

    /**
     * @param workerThreads Factory for worker threads. A factory that throws or returns null
     *                      makes {@link #initialize()} fall back to inline execution.
     */
    public WorkerPool(WorkerPoolConfig config, HandlerRegistry<I, O> handlers, ThreadFactory workerThreads) {
        this.config = Objects.requireNonNull(config, "config");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.workerThreads = Objects.requireNonNull(workerThreads, "workerThreads");
        this.runner = new TaskRunner<>(handlers);

        int poolNumber = POOL_COUNTER.incrementAndGet();
        this.dispatcher = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "WorkerPool-" + poolNumber + "-dispatcher");
            thread.setDaemon(true);
            dispatcherThread = thread;
            return thread;
        });
        this.dispatcher.setRemoveOnCancelPolicy(true);
    }

    /**
     * Create and initialize a worker pool.
     */
    public static <I, O> WorkerPool<I, O> create(WorkerPoolConfig config, HandlerRegistry<I, O> handlers)
            throws InterruptedException {
        WorkerPool<I, O> pool = new WorkerPool<>(config, handlers);
        pool.initialize();
        return pool;
    }

    public void addListener(PoolListener listener) {
        listeners.add(listener);
    }

    /**
     * Spawn {@code maxWorkers} workers and block until all of them report ready.
     * On failure the pool switches to inline execution instead of throwing.
     *
     * @throws IllegalStateException If called more than once
     */
    public synchronized void initialize() throws InterruptedException {
        if (state != State.NEW) throw new IllegalStateException("Already initialized");
        trace("Initializing worker pool with {} workers", config.maxWorkers());
        warnIfHeapBelowBudget();

        try {
            callOnDispatcher(() -> {
                for (int i = 0; i < config.maxWorkers(); i++) {
                    Slot<I, O> slot = new Slot<>(i);
                    slots.add(slot);
                    spawn(slot);
                }
                return null;
            });
            readySignal.get(config.initTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            enableFallback(e.getCause());
            return;
        } catch (TimeoutException e) {
            enableFallback(new WorkerInitException(
                    "Workers did not report ready within " + config.initTimeoutMs() + "ms"));
            return;
        }

        state = State.RUNNING;
        log.info("Worker pool ready with {} workers", config.maxWorkers());
    }

    /**
     * Whether initialization failed and calls are served by the inline executor.
     */
    public boolean isFallbackActive() {
        return state == State.DISABLED;
    }

    @Override
    public CompletableFuture<TaskResult<O>> submit(Task<I> task) {
        if (state == State.DISABLED) return fallback.submit(task);
        requireRunning();

        PendingTask<I, O> pending = new PendingTask<>(task);
        enqueueAll(List.of(pending));
        return pending.future;
    }

    @Override
    public CompletableFuture<List<TaskResult<O>>> process(List<Task<I>> tasks, Consumer<TaskResult<O>> onResult) {
        Task.requireUniqueIds(tasks);
        if (state == State.DISABLED) return fallback.process(tasks, onResult);
        requireRunning();
        if (tasks.isEmpty()) return CompletableFuture.completedFuture(List.of());

        trace("Processing {} tasks...", tasks.size());
        long start = System.nanoTime();
        List<PendingTask<I, O>> batch = tasks.stream().map(task -> new PendingTask<I, O>(task)).toList();
        List<CompletableFuture<TaskResult<O>>> observed = batch.stream()
                .map(pending -> pending.future.thenApply(result -> {
                    notifyResult(onResult, result);
                    return result;
                }))
                .toList();

        // The whole batch is queued in one dispatcher event so priorities apply across it
        enqueueAll(batch);

        return TaskExecutor.inOrder(observed).thenApply(results -> {
            long durationMs = TaskRunner.elapsedMs(start);
            trace("Completed {} tasks in {}ms", results.size(), durationMs);
            fire(listener -> listener.onBatchComplete(results.size(), durationMs));
            return results;
        });
    }

    @Override
    public PoolStats getStats() {
        if (state == State.DISABLED) return fallback.getStats();
        if (dispatcher.isTerminated()) return snapshot();
        try {
            return callOnDispatcher(this::snapshot);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return PoolStats.empty();
        } catch (ExecutionException | RejectedExecutionException e) {
            log.debug("Stats requested while the dispatcher was stopping", e);
            return PoolStats.empty();
        }
    }

    /**
     * Snapshot of every worker slot.
     */
    public List<WorkerState> getWorkerStates() {
        if (state == State.DISABLED || dispatcher.isTerminated()) return List.of();
        try {
            return callOnDispatcher(() -> slots.stream()
                    .map(slot -> new WorkerState(slot.id, slot.status,
                            slot.current != null ? slot.current.task.id() : null,
                            slot.tasksCompleted))
                    .toList());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        } catch (ExecutionException | RejectedExecutionException e) {
            log.debug("Worker states requested while the dispatcher was stopping", e);
            return List.of();
        }
    }

    /**
     * Graceful shutdown - discard queued tasks, wait up to the grace period for tasks in progress,
     * then terminate whatever is still running. Blocks until all workers are released.
     */
    @Override
    public synchronized void shutdown() throws InterruptedException {
        if (state == State.DISABLED) {
            fallback.shutdown();
            return;
        }
        if (state == State.NEW) {
            state = State.TERMINATED;
            dispatcher.shutdownNow();
            return;
        }
        if (state != State.RUNNING) return;

        log.info("Shutting down worker pool");
        state = State.SHUTTING_DOWN;

        try {
            CompletableFuture<Void> drained = callOnDispatcher(this::beginShutdown);
            drained.get(config.shutdownGraceMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Shutdown grace period of {}ms elapsed - forcing termination", config.shutdownGraceMs());
        } catch (ExecutionException e) {
            log.error("Unexpected error while draining workers", e.getCause());
        }

        try {
            callOnDispatcher(() -> {
                terminateWorkers();
                return null;
            });
        } catch (ExecutionException e) {
            log.error("Unexpected error while terminating workers", e.getCause());
        }

        dispatcher.shutdownNow();
        if (!dispatcher.awaitTermination(DISPATCHER_STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
            log.warn("Dispatcher did not terminate in time");
        }
        state = State.TERMINATED;
        fire(PoolListener::onShutdown);

        log.info("Worker pool shut down. Stats: processed={}, restarts={}", totalTasksProcessed, restarts);
    }

    // ---- Dispatcher events ----

    private void enqueue(List<PendingTask<I, O>> batch) {
        if (state != State.RUNNING) {
            batch.forEach(this::discard);
            return;
        }
        batch.forEach(queue::enqueue);
        dispatch();
    }

    private void dispatch() {
        if (state != State.RUNNING) return;
        while (!queue.isEmpty()) {
            Slot<I, O> slot = leastLoadedIdleSlot();
            if (slot == null) return; // No available workers, wait for one to free up
            assign(slot, queue.dequeue().orElseThrow());
        }
    }

    private Slot<I, O> leastLoadedIdleSlot() {
        return slots.stream()
                .filter(slot -> slot.status == WorkerStatus.IDLE)
                .min(Comparator.comparingInt(slot -> slot.tasksCompleted))
                .orElse(null);
    }

    private void assign(Slot<I, O> slot, PendingTask<I, O> pending) {
        Worker<I, O> worker = slot.worker;
        slot.status = WorkerStatus.BUSY;
        slot.current = pending;
        pending.startNanos = System.nanoTime();
        slot.timeout = dispatcher.schedule(() -> guarded(() -> taskTimedOut(worker, pending)),
                config.taskTimeoutMs(), TimeUnit.MILLISECONDS);

        trace("Assigning task {} to worker {}", pending.task.id(), slot.id);
        fire(listener -> listener.onTaskAssigned(pending.task.id(), slot.id));
        worker.assign(pending.task);
    }

    private void workerReady(Worker<I, O> worker) {
        Slot<I, O> slot = slotOf(worker);
        if (slot == null) return;

        slot.status = WorkerStatus.IDLE;
        trace("Worker {} ready", slot.id);
        if (!readySignal.isDone() && slots.stream().allMatch(s -> s.status == WorkerStatus.IDLE)) {
            readySignal.complete(null);
            fire(listener -> listener.onReady(slots.size()));
        }
        dispatch();
    }

    private void taskCompleted(Worker<I, O> worker, TaskResult<O> result) {
        Slot<I, O> slot = slotOf(worker);
        if (slot == null || slot.current == null || !slot.current.task.id().equals(result.taskId())) {
            log.debug("Ignoring late result for task {}", result.taskId());
            return;
        }

        PendingTask<I, O> pending = slot.current;
        cancelTimeout(slot);
        slot.current = null;
        slot.status = WorkerStatus.IDLE;
        slot.tasksCompleted++;

        trace("Task {} completed by worker {} ({})", result.taskId(), slot.id, result.success() ? "success" : "failed");
        resolve(pending, result);
        checkDrained();
        dispatch();
    }

    private void taskTimedOut(Worker<I, O> worker, PendingTask<I, O> pending) {
        Slot<I, O> slot = slotOf(worker);
        if (slot == null || slot.current != pending) return;

        slot.timeout = null;
        slot.current = null;
        TaskTimeoutException timeout = new TaskTimeoutException(pending.task.id(), config.taskTimeoutMs());
        log.warn("Task {} timed out on worker {}", pending.task.id(), slot.id);
        fire(listener -> listener.onTaskTimeout(pending.task.id(), slot.id));
        resolve(pending, TaskResult.failure(pending.task.id(), timeout, slot.id, pending.elapsedMs()));

        // Terminate and recreate worker (may be stuck)
        replace(slot);
        checkDrained();
        dispatch();
    }

    private void workerExited(Worker<I, O> worker, Throwable cause) {
        if (worker.isRetired()) return;
        Slot<I, O> slot = slotOf(worker);
        if (slot == null) return;

        WorkerCrashException crash = new WorkerCrashException(slot.id, cause);
        log.error("Worker {} terminated unexpectedly", slot.id, cause);
        fire(listener -> listener.onWorkerError(slot.id, cause != null ? cause : crash));

        PendingTask<I, O> pending = slot.current;
        if (pending != null) {
            cancelTimeout(slot);
            slot.current = null;
            resolve(pending, TaskResult.failure(pending.task.id(), crash, slot.id, pending.elapsedMs()));
        }

        replace(slot);
        checkDrained();
        dispatch();
    }

    private CompletableFuture<Void> beginShutdown() {
        List<PendingTask<I, O>> discarded = queue.drain();
        discarded.forEach(this::discard);
        if (!discarded.isEmpty()) log.info("Discarded {} pending tasks", discarded.size());

        drainedSignal = new CompletableFuture<>();
        checkDrained();
        return drainedSignal;
    }

    private void terminateWorkers() {
        for (Slot<I, O> slot : slots) {
            PendingTask<I, O> pending = slot.current;
            if (pending != null) {
                log.warn("Force terminating worker {} running task {}", slot.id, pending.task.id());
                cancelTimeout(slot);
                slot.current = null;
                resolve(pending, TaskResult.failure(pending.task.id(), "Task terminated: pool shut down",
                        slot.id, pending.elapsedMs()));
            }
            if (slot.worker != null) slot.worker.retire();
        }
        slots.clear();
    }

    // ---- Dispatcher helpers ----

    private Slot<I, O> slotOf(Worker<I, O> worker) {
        for (Slot<I, O> slot : slots) {
            if (slot.worker == worker) return slot;
        }
        return null;
    }

    private void spawn(Slot<I, O> slot) {
        Worker<I, O> worker = new Worker<>(slot.id, runner, workerCallbacks);
        Thread thread;
        try {
            thread = workerThreads.newThread(() -> runWorker(worker));
        } catch (RuntimeException e) {
            throw new WorkerInitException("Failed to create thread for worker " + slot.id, e);
        }
        if (thread == null) throw new WorkerInitException("Thread factory returned no thread for worker " + slot.id);

        worker.attach(thread);
        slot.worker = worker;
        slot.status = WorkerStatus.RESTARTING;
        slot.tasksCompleted = 0;
        try {
            thread.start();
        } catch (OutOfMemoryError | IllegalThreadStateException e) {
            slot.worker = null;
            throw new WorkerInitException("Failed to start thread for worker " + slot.id, e);
        }
        trace("Worker {} created", slot.id);
    }

    /**
     * Retire the slot's worker and put a fresh one in its place.
     */
    private void replace(Slot<I, O> slot) {
        Worker<I, O> old = slot.worker;
        slot.worker = null;
        slot.status = WorkerStatus.RESTARTING;
        if (old != null) old.retire();
        restarts++;

        if (state == State.RUNNING) respawn(slot);
    }

    private void respawn(Slot<I, O> slot) {
        if (state != State.RUNNING || slot.worker != null || !slots.contains(slot)) return;
        try {
            spawn(slot);
        } catch (WorkerInitException e) {
            log.error("Could not restart worker {}, retrying in {}ms", slot.id, RESPAWN_BACKOFF_MS, e);
            dispatcher.schedule(() -> guarded(() -> respawn(slot)), RESPAWN_BACKOFF_MS, TimeUnit.MILLISECONDS);
        }
    }

    private void resolve(PendingTask<I, O> pending, TaskResult<O> result) {
        totalTasksProcessed++;
        fire(listener -> listener.onTaskComplete(result));
        pending.future.complete(result);
    }

    private void discard(PendingTask<I, O> pending) {
        pending.future.complete(TaskResult.failure(pending.task.id(), "Task discarded: pool shut down",
                TaskResult.NO_WORKER_ID, 0));
    }

    private void cancelTimeout(Slot<I, O> slot) {
        if (slot.timeout != null) {
            slot.timeout.cancel(false);
            slot.timeout = null;
        }
    }

    private void checkDrained() {
        if (drainedSignal != null && slots.stream().allMatch(slot -> slot.current == null)) {
            drainedSignal.complete(null);
        }
    }

    private PoolStats snapshot() {
        int total = slots.size();
        int busy = (int) slots.stream().filter(slot -> slot.status == WorkerStatus.BUSY).count();
        int idle = (int) slots.stream().filter(slot -> slot.status == WorkerStatus.IDLE).count();
        int active = (int) slots.stream().filter(slot -> slot.current != null).count();
        return new PoolStats(total, idle, busy, queue.size(), active, totalTasksProcessed, restarts,
                PoolStats.utilization(busy, total), PoolStats.heapUsedMB());
    }

    // ---- Threading plumbing ----

    private void runWorker(Worker<I, O> worker) {
        Throwable cause = null;
        try {
            worker.run();
        } catch (Throwable t) {
            cause = t;
        } finally {
            Throwable exitCause = cause;
            onDispatcher(() -> workerExited(worker, exitCause));
        }
    }

    private void enqueueAll(List<PendingTask<I, O>> batch) {
        if (!onDispatcher(() -> enqueue(batch))) {
            batch.forEach(this::discard);
        }
    }

    /**
     * Post an event to the dispatcher.
     *
     * @return false if the dispatcher has stopped and the event was dropped
     */
    private boolean onDispatcher(Runnable event) {
        try {
            dispatcher.execute(() -> guarded(event));
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("Dispatcher stopped, dropping event");
            return false;
        }
    }

    private <T> T callOnDispatcher(Callable<T> call) throws InterruptedException, ExecutionException {
        if (Thread.currentThread() == dispatcherThread) {
            try {
                return call.call();
            } catch (Exception e) {
                throw new ExecutionException(e);
            }
        }
        return dispatcher.submit(call).get();
    }

    private void guarded(Runnable event) {
        try {
            event.run();
        } catch (RuntimeException e) {
            log.error("Dispatcher event failed", e);
        }
    }

    private void fire(Consumer<PoolListener> event) {
        for (PoolListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Pool listener failed", e);
            }
        }
    }

    private void notifyResult(Consumer<TaskResult<O>> onResult, TaskResult<O> result) {
        try {
            onResult.accept(result);
        } catch (RuntimeException e) {
            log.warn("Result callback failed for task {}", result.taskId(), e);
        }
    }

    private void enableFallback(Throwable cause) throws InterruptedException {
        log.warn("Worker pool initialization failed, falling back to inline execution", cause);
        try {
            callOnDispatcher(() -> {
                slots.forEach(slot -> {
                    if (slot.worker != null) slot.worker.retire();
                });
                slots.clear();
                return null;
            });
        } catch (ExecutionException e) {
            log.error("Failed to release partially started workers", e.getCause());
        }
        dispatcher.shutdownNow();
        fallback = new InlineConcurrentExecutor<>(config, handlers);
        state = State.DISABLED;
    }

    /**
     * Workers share the JVM heap, so the per-worker budget can only be checked against its total.
     * A worker that runs out of memory dies with {@link OutOfMemoryError} and is replaced like any crash.
     */
    private void warnIfHeapBelowBudget() {
        long budgetMB = (long) config.maxWorkers() * config.memoryLimitMB();
        long maxHeapMB = Runtime.getRuntime().maxMemory() / (1024 * 1024);
        if (maxHeapMB < budgetMB) {
            log.warn("Max heap of {}MB is below the budget of {} workers x {}MB",
                    maxHeapMB, config.maxWorkers(), config.memoryLimitMB());
        }
    }

    private void requireRunning() {
        if (state != State.RUNNING) {
            throw new IllegalStateException("Worker pool is not running (" + state
                    + "). Call initialize() first, and ensure shutdown has not been called.");
        }
    }

    private void trace(String format, Object... args) {
        if (config.verbose()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }

    private static ThreadFactory defaultWorkerThreads() {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, "worker-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
