package io.github.galkahana.analysisrunner.analysis;

/**
 * How far a routine looks beyond the file it is given.
 */
public enum RoutineScope {
    /** Findings depend only on the file itself; the routine may be skipped when no matching file changed. */
    FILE,
    /** Findings may depend on other files in the workspace; never skipped. */
    WORKSPACE
}
