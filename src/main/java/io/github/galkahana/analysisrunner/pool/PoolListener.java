package io.github.galkahana.analysisrunner.pool;

import io.github.galkahana.analysisrunner.TaskResult;

/**
 * Lifecycle callbacks fired by {@link WorkerPool}.
 * <p>
 * Callbacks run on the dispatcher thread and must return quickly.
 */
public interface PoolListener {

    default void onReady(int workerCount) {}

    default void onTaskAssigned(String taskId, int workerId) {}

    default void onTaskComplete(TaskResult<?> result) {}

    default void onTaskTimeout(String taskId, int workerId) {}

    default void onWorkerError(int workerId, Throwable error) {}

    default void onBatchComplete(int taskCount, long durationMs) {}

    default void onShutdown() {}
}
