package io.github.galkahana.analysisrunner.analysis;

import io.github.galkahana.analysisrunner.Task;
import io.github.galkahana.analysisrunner.TaskExecutor;
import io.github.galkahana.analysisrunner.TaskResult;
import io.github.galkahana.analysisrunner.pool.WorkerPool;
import io.github.galkahana.analysisrunner.pool.WorkerPoolConfig;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns "run these routines over this workspace" into one batch of independent
 * {@code (file, routine)} tasks, runs it on a {@link TaskExecutor} and flattens the findings.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RoutineRegistry registry = new RoutineRegistry()
 *     .register("todo", TodoCommentRoutine::new)
 *     .register("long-lines", LongLineRoutine::new);
 *
 * try (TaskGenerator generator = TaskGenerator.withWorkerPool(registry, WorkerPoolConfig.defaults())) {
 *     List<Finding> findings = generator.analyze(
 *         Path.of("/repo"),
 *         AnalysisOptions.defaults().withExtensions(Set.of(".java")),
 *         event -> System.out.println(event.phase().label() + " " + event.completed() + "/" + event.total())
 *     );
 * }
 * }</pre>
 *
 * <p>
 * A failing {@code (file, routine)} pair is logged and dropped; it never aborts the batch.
 * </p>
 */
@Slf4j
public class TaskGenerator implements AutoCloseable {

    private final RoutineRegistry routines;
    private final FileEnumerator fileEnumerator;
    private final TaskExecutor<RoutineTask, List<Finding>> executor;

    /**
     * @param routines Registry the executor's handlers were built from
     * @param fileEnumerator Source of candidate files
     * @param executor Pooled or inline executor running the generated tasks
     */
    public TaskGenerator(RoutineRegistry routines, FileEnumerator fileEnumerator,
                         TaskExecutor<RoutineTask, List<Finding>> executor) {
        this.routines = routines;
        this.fileEnumerator = fileEnumerator;
        this.executor = executor;
    }

    /**
     * Build a generator backed by a freshly initialized {@link WorkerPool}.
     * Routines must be registered before this call.
     */
    public static TaskGenerator withWorkerPool(RoutineRegistry routines, WorkerPoolConfig config)
            throws InterruptedException {
        return new TaskGenerator(routines, new WorkspaceFileCollector(), WorkerPool.create(config, routines.toHandlers()));
    }

    /**
     * Run the selected routines over every candidate file of the workspace.
     *
     * @param workspaceRoot Directory to analyze
     * @param options Routine selection, extensions and the optional changed-files hint
     * @param progress Receives phase boundaries and one event per completed task
     * @return Findings of every successful task, each tagged with its routine, in task order
     * @throws IOException If the workspace cannot be enumerated
     */
    public List<Finding> analyze(Path workspaceRoot, AnalysisOptions options, ProgressListener progress)
            throws IOException, InterruptedException {

        Path root = workspaceRoot.toAbsolutePath().normalize();
        List<String> selected = (options.routines().isEmpty() ? routines.names() : options.routines()).stream()
                .distinct()
                .toList();
        Map<String, Optional<Routine>> resolved = new LinkedHashMap<>();
        selected.forEach(name -> resolved.put(name, routines.create(name)));

        emit(progress, ProgressEvent.message(ProgressPhase.COLLECT_FILES, "Collecting files..."));
        List<Path> files = fileEnumerator.collect(root, options.extensions());
        if (files.isEmpty()) {
            log.info("No files found under {}", root);
            emit(progress, ProgressEvent.message(ProgressPhase.COMPLETE, "No files found"));
            return List.of();
        }
        emit(progress, new ProgressEvent(ProgressPhase.COLLECT_FILES, files.size(), files.size(),
                "Found " + files.size() + " files", List.of()));

        List<String> skipped = skippedRoutines(resolved, options.changedFiles(), files);
        List<String> active = selected.stream().filter(name -> !skipped.contains(name)).toList();
        if (!skipped.isEmpty()) log.info("Skipping {} routines with no candidate files: {}", skipped.size(), skipped);

        List<Task<RoutineTask>> tasks = buildTasks(root, files, active, resolved);
        int total = tasks.size();
        emit(progress, new ProgressEvent(ProgressPhase.RUN_DETECTORS, total, 0,
                "Running " + active.size() + " routines on " + files.size() + " files", skipped));
        if (tasks.isEmpty()) {
            emit(progress, new ProgressEvent(ProgressPhase.COMPLETE, 0, 0, "No routines to run", skipped));
            return List.of();
        }

        AtomicInteger completed = new AtomicInteger(0);
        List<TaskResult<List<Finding>>> results;
        try {
            results = executor.process(tasks, result -> emit(progress, new ProgressEvent(
                    ProgressPhase.RUN_DETECTORS, total, completed.incrementAndGet(), result.taskId(), skipped))).get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task batch failed unexpectedly", e.getCause());
        }

        List<Finding> findings = new ArrayList<>();
        int failed = 0;
        for (int i = 0; i < tasks.size(); i++) {
            RoutineTask task = tasks.get(i).data();
            TaskResult<List<Finding>> result = results.get(i);
            if (!result.success()) {
                failed++;
                log.warn("Routine {} failed on {}: {}", task.routineName(), task.filePath(), result.error());
                continue;
            }
            for (Finding finding : result.data()) {
                findings.add(finding.withRoutine(task.routineName()));
            }
        }

        log.info("Analysis of {} complete: {} findings from {} tasks ({} failed)", root, findings.size(), total, failed);
        emit(progress, new ProgressEvent(ProgressPhase.COMPLETE, total, total,
                findings.size() + " findings from " + total + " tasks (" + failed + " failed)", skipped));
        return findings;
    }

    public List<Finding> analyze(Path workspaceRoot, AnalysisOptions options) throws IOException, InterruptedException {
        return analyze(workspaceRoot, options, ProgressListener.NONE);
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdown();
    }

    /**
     * With a changed-files hint, FILE-scoped routines that apply to none of the collected files.
     * Such a routine would only produce empty results, so skipping it leaves the findings unchanged.
     * Unknown routines and WORKSPACE-scoped routines are never skipped.
     */
    private static List<String> skippedRoutines(Map<String, Optional<Routine>> resolved, Set<Path> changedFiles,
                                                List<Path> files) {
        if (changedFiles == null) return List.of();
        log.debug("Incremental run with {} changed files", changedFiles.size());
        List<String> skipped = new ArrayList<>();
        resolved.forEach((name, routine) -> {
            if (routine.isEmpty() || routine.get().scope() != RoutineScope.FILE) return;
            if (files.stream().noneMatch(routine.get()::appliesTo)) skipped.add(name);
        });
        return skipped;
    }

    private static List<Task<RoutineTask>> buildTasks(Path root, List<Path> files, List<String> routineNames,
                                                      Map<String, Optional<Routine>> resolved) {
        List<Task<RoutineTask>> tasks = new ArrayList<>(files.size() * routineNames.size());
        for (Path file : files) {
            String relative = root.relativize(file.toAbsolutePath().normalize()).toString();
            for (String name : routineNames) {
                int priority = resolved.get(name).map(Routine::priority).orElse(0);
                tasks.add(new Task<>(name + ":" + relative, name, new RoutineTask(root, file, name), priority));
            }
        }
        return tasks;
    }

    private static void emit(ProgressListener progress, ProgressEvent event) {
        try {
            progress.onProgress(event);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed on {} event", event.phase().label(), e);
        }
    }
}
