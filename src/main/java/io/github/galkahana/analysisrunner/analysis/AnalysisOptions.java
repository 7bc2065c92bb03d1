package io.github.galkahana.analysisrunner.analysis;

import io.github.galkahana.analysisrunner.ConfigurationException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * What to run in one {@link TaskGenerator#analyze} call.
 *
 * @param routines Routine names to run; empty runs every registered routine
 * @param extensions File extensions to collect, with the leading dot; empty uses {@link #DEFAULT_EXTENSIONS}
 * @param changedFiles Files changed since the previous run. When present, routines that cannot apply to
 *                     any collected file are skipped; the findings are the same either way. Null disables skipping
 */
public record AnalysisOptions(List<String> routines, Set<String> extensions, Set<Path> changedFiles) {

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(
            ".ts", ".tsx", ".js", ".jsx", ".py", ".go", ".rs", ".java");

    public AnalysisOptions {
        routines = routines == null ? List.of() : List.copyOf(routines);
        extensions = extensions == null || extensions.isEmpty() ? DEFAULT_EXTENSIONS : Set.copyOf(extensions);
        changedFiles = changedFiles == null ? null : Set.copyOf(changedFiles);
        for (String extension : extensions) {
            if (!extension.startsWith(".")) {
                throw new ConfigurationException("Extension must start with '.', got " + extension);
            }
        }
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(List.of(), Set.of(), null);
    }

    public AnalysisOptions withRoutines(List<String> routines) {
        return new AnalysisOptions(routines, extensions, changedFiles);
    }

    public AnalysisOptions withExtensions(Set<String> extensions) {
        return new AnalysisOptions(routines, extensions, changedFiles);
    }

    public AnalysisOptions withChangedFiles(Set<Path> changedFiles) {
        return new AnalysisOptions(routines, extensions, changedFiles);
    }
}
