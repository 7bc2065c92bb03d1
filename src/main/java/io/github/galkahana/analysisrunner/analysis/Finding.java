package io.github.galkahana.analysisrunner.analysis;

/**
 * One issue reported by a routine.
 *
 * @param file Absolute path of the analyzed file
 * @param line 1-based line number, 0 when the finding applies to the whole file
 * @param severity Free-form severity label (e.g. "high")
 * @param message Human readable description
 * @param routine Name of the routine that produced the finding, filled in during aggregation
 */
public record Finding(String file, int line, String severity, String message, String routine) {

    public Finding(String file, int line, String severity, String message) {
        this(file, line, severity, message, null);
    }

    public Finding withRoutine(String routine) {
        return new Finding(file, line, severity, message, routine);
    }
}
