package io.github.galkahana.analysisrunner.pool;

import java.lang.management.ManagementFactory;

/**
 * Point-in-time executor statistics. Derived from executor state, never authoritative.
 *
 * @param totalWorkers Worker slots currently owned
 * @param idleWorkers Workers waiting for a task
 * @param busyWorkers Workers running a task
 * @param queueLength Tasks waiting for a worker
 * @param activeTasks Tasks currently assigned to a worker
 * @param totalTasksProcessed Results delivered since start
 * @param restarts Workers replaced after a timeout or crash
 * @param utilizationRate busyWorkers / totalWorkers, 0 when there are no workers
 * @param memoryUsageMB Heap in use at snapshot time; workers share the JVM heap
 */
public record PoolStats(int totalWorkers, int idleWorkers, int busyWorkers, int queueLength, int activeTasks,
                        long totalTasksProcessed, int restarts, double utilizationRate, long memoryUsageMB) {

    public static PoolStats empty() {
        return new PoolStats(0, 0, 0, 0, 0, 0, 0, 0.0, 0);
    }

    static double utilization(int busy, int total) {
        return total == 0 ? 0.0 : (double) busy / total;
    }

    static long heapUsedMB() {
        return ManagementFactory.getMemoryMXBean().getHeapMemoryUsage().getUsed() / (1024 * 1024);
    }
}
