package io.github.galkahana.analysisrunner.pool;

/**
 * Snapshot of one worker slot.
 *
 * @param id Slot id, stable across restarts
 * @param status Current status
 * @param currentTaskId Task held by the worker, null unless busy
 * @param tasksCompleted Tasks completed by the current worker in this slot
 */
public record WorkerState(int id, WorkerStatus status, String currentTaskId, int tasksCompleted) {
}
