package io.github.galkahana.analysisrunner;

/**
 * Outcome of exactly one {@link Task}.
 *
 * @param taskId Id of the task this result belongs to
 * @param success Whether the handler returned normally
 * @param data Handler output, null on failure
 * @param error Failure description, null on success
 * @param workerId Worker slot that ran the task, {@link #NO_WORKER_ID} for inline execution or tasks never assigned
 * @param durationMs Wall-clock time from dispatch to result
 * @param <O> Output type
 */
public record TaskResult<O>(String taskId, boolean success, O data, String error, int workerId, long durationMs) {

    public static final int NO_WORKER_ID = -1;

    public static <O> TaskResult<O> success(String taskId, O data, int workerId, long durationMs) {
        return new TaskResult<>(taskId, true, data, null, workerId, durationMs);
    }

    public static <O> TaskResult<O> failure(String taskId, String error, int workerId, long durationMs) {
        return new TaskResult<>(taskId, false, null, error, workerId, durationMs);
    }

    public static <O> TaskResult<O> failure(String taskId, Throwable cause, int workerId, long durationMs) {
        return failure(taskId, describe(cause), workerId, durationMs);
    }

    static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
