package io.github.galkahana.analysisrunner;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A unit of work submitted to a {@link TaskExecutor}.
 *
 * @param id Caller-unique task identifier
 * @param type Handler selector, resolved through a {@link HandlerRegistry}
 * @param data Opaque payload handed to the handler
 * @param priority Higher values are dispatched first (default 0)
 * @param retries Extra attempts made when the handler throws (default 0)
 * @param <I> Payload type
 */
public record Task<I>(String id, String type, I data, int priority, int retries) {

    public Task {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (retries < 0) throw new IllegalArgumentException("retries must be >= 0, got " + retries);
    }

    public Task(String id, String type, I data) {
        this(id, type, data, 0, 0);
    }

    public Task(String id, String type, I data, int priority) {
        this(id, type, data, priority, 0);
    }

    /**
     * Rejects a batch in which two tasks share an id.
     *
     * @throws IllegalArgumentException on the first duplicate id found
     */
    public static void requireUniqueIds(List<? extends Task<?>> tasks) {
        Set<String> seen = new HashSet<>();
        for (Task<?> task : tasks) {
            if (!seen.add(task.id())) {
                throw new IllegalArgumentException("Duplicate task id in batch: " + task.id());
            }
        }
    }
}
