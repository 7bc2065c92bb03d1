package io.github.galkahana.analysisrunner.analysis;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Lists the candidate files of a workspace.
 */
@FunctionalInterface
public interface FileEnumerator {

    /**
     * @param workspaceRoot Directory to search
     * @param extensions Extensions to include, with the leading dot
     * @return Absolute paths, without duplicates
     */
    List<Path> collect(Path workspaceRoot, Set<String> extensions) throws IOException;
}
