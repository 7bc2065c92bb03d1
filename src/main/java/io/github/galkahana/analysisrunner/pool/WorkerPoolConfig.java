package io.github.galkahana.analysisrunner.pool;

import io.github.galkahana.analysisrunner.ConfigurationException;

/**
 * Construction options shared by {@link WorkerPool} and {@link InlineConcurrentExecutor}.
 *
 * @param maxWorkers Number of concurrent workers (default: available processors)
 * @param memoryLimitMB Heap budget per worker, checked against the JVM max heap at startup (default 1024)
 * @param taskTimeoutMs Timeout per dispatched task (default 30000)
 * @param shutdownGraceMs How long shutdown waits for in-flight tasks before forcing termination (default 30000)
 * @param initTimeoutMs How long initialization waits for workers to report ready (default 10000)
 * @param verbose Log per-task dispatch at INFO instead of DEBUG
 */
public record WorkerPoolConfig(int maxWorkers, int memoryLimitMB, long taskTimeoutMs, long shutdownGraceMs,
                               long initTimeoutMs, boolean verbose) {

    public static final int DEFAULT_MEMORY_LIMIT_MB = 1024;
    public static final long DEFAULT_TASK_TIMEOUT_MS = 30_000;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 30_000;
    public static final long DEFAULT_INIT_TIMEOUT_MS = 10_000;

    public WorkerPoolConfig {
        if (maxWorkers <= 0) throw new ConfigurationException("maxWorkers must be > 0, got " + maxWorkers);
        if (memoryLimitMB <= 0) throw new ConfigurationException("memoryLimitMB must be > 0, got " + memoryLimitMB);
        if (taskTimeoutMs <= 0) throw new ConfigurationException("taskTimeoutMs must be > 0, got " + taskTimeoutMs);
        if (shutdownGraceMs < 0) throw new ConfigurationException("shutdownGraceMs must be >= 0, got " + shutdownGraceMs);
        if (initTimeoutMs <= 0) throw new ConfigurationException("initTimeoutMs must be > 0, got " + initTimeoutMs);
    }

    public static WorkerPoolConfig defaults() {
        return new WorkerPoolConfig(Runtime.getRuntime().availableProcessors(), DEFAULT_MEMORY_LIMIT_MB,
                DEFAULT_TASK_TIMEOUT_MS, DEFAULT_SHUTDOWN_GRACE_MS, DEFAULT_INIT_TIMEOUT_MS, false);
    }

    public WorkerPoolConfig withMaxWorkers(int maxWorkers) {
        return new WorkerPoolConfig(maxWorkers, memoryLimitMB, taskTimeoutMs, shutdownGraceMs, initTimeoutMs, verbose);
    }

    public WorkerPoolConfig withMemoryLimitMB(int memoryLimitMB) {
        return new WorkerPoolConfig(maxWorkers, memoryLimitMB, taskTimeoutMs, shutdownGraceMs, initTimeoutMs, verbose);
    }

    public WorkerPoolConfig withTaskTimeoutMs(long taskTimeoutMs) {
        return new WorkerPoolConfig(maxWorkers, memoryLimitMB, taskTimeoutMs, shutdownGraceMs, initTimeoutMs, verbose);
    }

    public WorkerPoolConfig withShutdownGraceMs(long shutdownGraceMs) {
        return new WorkerPoolConfig(maxWorkers, memoryLimitMB, taskTimeoutMs, shutdownGraceMs, initTimeoutMs, verbose);
    }

    public WorkerPoolConfig withInitTimeoutMs(long initTimeoutMs) {
        return new WorkerPoolConfig(maxWorkers, memoryLimitMB, taskTimeoutMs, shutdownGraceMs, initTimeoutMs, verbose);
    }

    public WorkerPoolConfig withVerbose(boolean verbose) {
        return new WorkerPoolConfig(maxWorkers, memoryLimitMB, taskTimeoutMs, shutdownGraceMs, initTimeoutMs, verbose);
    }
}
