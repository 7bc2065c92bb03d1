package io.github.galkahana.analysisrunner.analysis;

import java.nio.file.Path;

/**
 * Payload of a generated task: run {@code routineName} on {@code filePath}.
 */
public record RoutineTask(Path workspaceRoot, Path filePath, String routineName) {
}
