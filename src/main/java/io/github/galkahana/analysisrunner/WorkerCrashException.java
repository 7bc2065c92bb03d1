package io.github.galkahana.analysisrunner;

import lombok.Getter;

/**
 * A worker terminated unexpectedly. Recorded as a failed result, never thrown to callers.
 */
@Getter
public class WorkerCrashException extends RuntimeException {

    private final int workerId;

    public WorkerCrashException(int workerId, Throwable cause) {
        super("Worker " + workerId + " crashed: " + describe(cause), cause);
        this.workerId = workerId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "thread exited";
        return cause.getMessage() != null
                ? cause.getClass().getSimpleName() + ": " + cause.getMessage()
                : cause.getClass().getSimpleName();
    }
}
