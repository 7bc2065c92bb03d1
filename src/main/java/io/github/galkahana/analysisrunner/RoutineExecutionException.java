package io.github.galkahana.analysisrunner;

import java.nio.file.Path;
import lombok.Getter;

/**
 * An analysis routine threw while processing a file.
 */
@Getter
public class RoutineExecutionException extends Exception {

    private final String routine;
    private final Path file;

    public RoutineExecutionException(String routine, Path file, Throwable cause) {
        super("Routine '" + routine + "' failed on " + file + ": " + cause.getMessage(), cause);
        this.routine = routine;
        this.file = file;
    }
}
