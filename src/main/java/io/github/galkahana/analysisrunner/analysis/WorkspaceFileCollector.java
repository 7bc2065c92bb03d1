package io.github.galkahana.analysisrunner.analysis;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import lombok.extern.slf4j.Slf4j;

/**
 * Walks a workspace and returns the files whose extension is requested.
 * <p>
 * Build output, dependency and tool directories are pruned from the walk, as are dot files
 * and minified bundles.
 */
@Slf4j
public class WorkspaceFileCollector implements FileEnumerator {

    /** Directories never descended into. */
    public static final Set<String> IGNORE_DIRS = Set.of(
            "node_modules", "dist", ".next", "build", ".git", "out", "coverage", ".odavl", "reports",
            "vendor", "__pycache__", ".pytest_cache", "target", ".gradle", ".idea", ".vscode"
    );

    private static final List<String> IGNORE_SUFFIXES = List.of(".min.js", ".bundle.js");

    @Override
    public List<Path> collect(Path workspaceRoot, Set<String> extensions) throws IOException {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            log.warn("Workspace {} is not a directory", root);
            return List.of();
        }

        TreeSet<Path> files = new TreeSet<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && isIgnoredDirectory(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && isCandidate(file.getFileName().toString(), extensions)) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("Skipping unreadable path {}: {}", file, e.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        log.debug("Collected {} files under {}", files.size(), root);
        return List.copyOf(files);
    }

    private static boolean isIgnoredDirectory(String name) {
        return IGNORE_DIRS.contains(name) || name.startsWith(".");
    }

    private static boolean isCandidate(String name, Set<String> extensions) {
        if (name.startsWith(".")) return false;
        if (IGNORE_SUFFIXES.stream().anyMatch(name::endsWith)) return false;
        return extensions.stream().anyMatch(name::endsWith);
    }
}
