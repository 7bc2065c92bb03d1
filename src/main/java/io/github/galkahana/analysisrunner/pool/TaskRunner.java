package io.github.galkahana.analysisrunner.pool;

import io.github.galkahana.analysisrunner.HandlerRegistry;
import io.github.galkahana.analysisrunner.Task;
import io.github.galkahana.analysisrunner.TaskHandler;
import io.github.galkahana.analysisrunner.TaskResult;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves a task's handler and runs it with the task's retry budget.
 * <p>
 * Ordinary exceptions become failed results. {@link Error}s propagate so that the
 * hosting worker terminates and the pool can replace it.
 */
@Slf4j
class TaskRunner<I, O> {

    private final HandlerRegistry<I, O> handlers;
    private final Map<Integer, Retry> retries = new ConcurrentHashMap<>();

    TaskRunner(HandlerRegistry<I, O> handlers) {
        this.handlers = handlers;
    }

    /**
     * @throws InterruptedException If the hosting thread was interrupted while the handler ran
     */
    TaskResult<O> run(Task<I> task, int workerId) throws InterruptedException {
        long start = System.nanoTime();
        Optional<TaskHandler<I, O>> handler = handlers.resolve(task.type());
        if (handler.isEmpty()) {
            log.warn("Task {} has unknown type '{}'", task.id(), task.type());
            return TaskResult.failure(task.id(), "Unknown task type: " + task.type(), workerId, elapsedMs(start));
        }

        try {
            O output = retryFor(task.retries()).executeCallable(() -> {
                log.debug("Processing task {} on worker {}", task.id(), workerId);
                return handler.get().apply(task.data());
            });
            return TaskResult.success(task.id(), output, workerId, elapsedMs(start));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (Exception e) {
            log.error("Task {} failed after {} attempts", task.id(), task.retries() + 1);
            return TaskResult.failure(task.id(), e, workerId, elapsedMs(start));
        }
    }

    private Retry retryFor(int taskRetries) {
        return retries.computeIfAbsent(taskRetries, n -> Retry.of("task-retry-" + n, RetryConfig.custom()
                .maxAttempts(n + 1)
                .retryOnException(e -> !(e instanceof InterruptedException))
                .build()));
    }

    static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
