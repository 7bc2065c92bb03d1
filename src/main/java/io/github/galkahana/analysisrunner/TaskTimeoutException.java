package io.github.galkahana.analysisrunner;

import lombok.Getter;

/**
 * A dispatched task outlived its timeout. Recorded as a failed result, never thrown to callers.
 */
@Getter
public class TaskTimeoutException extends RuntimeException {

    private final String taskId;
    private final long timeoutMs;

    public TaskTimeoutException(String taskId, long timeoutMs) {
        super("Task timeout after " + timeoutMs + "ms");
        this.taskId = taskId;
        this.timeoutMs = timeoutMs;
    }
}
