package io.github.galkahana.analysisrunner;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup table from task {@code type} to the handler that runs it.
 * <p>
 * Populated once at startup and then shared read-only by every worker.
 *
 * @param <I> Task payload type
 * @param <O> Handler output type
 */
public class HandlerRegistry<I, O> {

    private final Map<String, TaskHandler<I, O>> handlers = new ConcurrentHashMap<>();

    public HandlerRegistry<I, O> register(String type, TaskHandler<I, O> handler) {
        if (handlers.putIfAbsent(type, handler) != null) {
            throw new IllegalArgumentException("Handler already registered for type: " + type);
        }
        return this;
    }

    public Optional<TaskHandler<I, O>> resolve(String type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Set<String> types() {
        return Set.copyOf(handlers.keySet());
    }
}
