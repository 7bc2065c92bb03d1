package io.github.galkahana.analysisrunner.analysis;

import io.github.galkahana.analysisrunner.HandlerRegistry;
import io.github.galkahana.analysisrunner.RoutineExecutionException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Startup-time table of analysis routines, keyed by stable name.
 * <p>
 * Routines are created through their factory on lookup, so each task gets a fresh instance.
 */
public class RoutineRegistry {

    private final Map<String, Supplier<? extends Routine>> factories = new LinkedHashMap<>();

    public synchronized RoutineRegistry register(String name, Supplier<? extends Routine> factory) {
        if (factories.putIfAbsent(name, factory) != null) {
            throw new IllegalArgumentException("Routine already registered: " + name);
        }
        return this;
    }

    public synchronized Optional<Routine> create(String name) {
        Supplier<? extends Routine> factory = factories.get(name);
        return factory == null ? Optional.empty() : Optional.of(factory.get());
    }

    /**
     * Registered names, in registration order.
     */
    public synchronized List<String> names() {
        return List.copyOf(factories.keySet());
    }

    /**
     * Expose every routine as a task handler whose type is the routine name.
     * A routine is not invoked for files outside its declared extensions.
     */
    public HandlerRegistry<RoutineTask, List<Finding>> toHandlers() {
        HandlerRegistry<RoutineTask, List<Finding>> handlers = new HandlerRegistry<>();
        for (String name : names()) {
            handlers.register(name, task -> runRoutine(name, task));
        }
        return handlers;
    }

    private List<Finding> runRoutine(String name, RoutineTask task)
            throws RoutineExecutionException, InterruptedException {
        Routine routine = create(name).orElseThrow(() -> new IllegalStateException("Routine vanished: " + name));
        if (!routine.appliesTo(task.filePath())) return List.of();
        try {
            List<Finding> findings = routine.run(task.filePath());
            return findings == null ? List.of() : findings;
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new RoutineExecutionException(name, task.filePath(), e);
        }
    }
}
