package io.github.galkahana.analysisrunner.analysis;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Pluggable analysis unit: takes a file and returns the findings for it.
 * Implementations are expected to be free of side effects beyond their return value.
 */
@FunctionalInterface
public interface Routine {

    List<Finding> run(Path file) throws Exception;

    default RoutineScope scope() {
        return RoutineScope.FILE;
    }

    /**
     * File extensions this routine understands, including the dot (e.g. ".java").
     * Empty means every file.
     */
    default Set<String> extensions() {
        return Set.of();
    }

    default int priority() {
        return 0;
    }

    default boolean appliesTo(Path file) {
        Set<String> extensions = extensions();
        if (extensions.isEmpty()) return true;
        String name = file.getFileName().toString();
        return extensions.stream().anyMatch(name::endsWith);
    }
}
