package io.github.galkahana.analysisrunner.pool;

import io.github.galkahana.analysisrunner.HandlerRegistry;
import io.github.galkahana.analysisrunner.Task;
import io.github.galkahana.analysisrunner.TaskResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

public class WorkerPoolTest {

    private final List<Integer> executionOrder = Collections.synchronizedList(new ArrayList<>());
    private final ConcurrentHashMap<Integer, AtomicInteger> attemptCounts = new ConcurrentHashMap<>();
    private final List<WorkerPool<Integer, Integer>> pools = new ArrayList<>();

    private HandlerRegistry<Integer, Integer> handlers() {
        return new HandlerRegistry<Integer, Integer>()
            .register("double", num -> num * 2)
            .register("sleep", millis -> {
                Thread.sleep(millis);
                return millis;
            })
            .register("record", num -> {
                executionOrder.add(num);
                return num;
            })
            .register("fail", num -> {
                throw new RuntimeException("Simulated failure for " + num);
            })
            .register("flaky", num -> {
                int attemptNumber = attemptCounts.computeIfAbsent(num, k -> new AtomicInteger(0)).incrementAndGet();
                if (attemptNumber <= 2) {
                    throw new RuntimeException("Simulated failure on attempt " + attemptNumber);
                }
                return num;
            })
            .register("crash", num -> {
                throw new Error("Simulated worker crash");
            })
            .register("exhaust", num -> {
                throw new OutOfMemoryError("Java heap space");
            })
            .register("allocate", megabytes -> {
                byte[][] blocks = new byte[megabytes][];
                for (int i = 0; i < megabytes; i++) {
                    blocks[i] = new byte[1024 * 1024];
                }
                return blocks.length;
            });
    }

    private WorkerPool<Integer, Integer> startPool(WorkerPoolConfig config) throws InterruptedException {
        WorkerPool<Integer, Integer> pool = new WorkerPool<>(config, handlers());
        pools.add(pool);
        pool.initialize();
        return pool;
    }

    private static WorkerPoolConfig config(int workers) {
        return WorkerPoolConfig.defaults().withMaxWorkers(workers).withShutdownGraceMs(2_000);
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        for (WorkerPool<Integer, Integer> pool : pools) {
            pool.shutdown();
        }
    }

    @Test
    public void testInitialize_YieldsRequestedWorkerCount() throws Exception {
        for (int workers : new int[] {1, 2, 4}) {
            // Act
            WorkerPool<Integer, Integer> pool = startPool(config(workers));
            PoolStats stats = pool.getStats();

            // Assert
            assertEquals(workers, stats.totalWorkers(), "Pool should own " + workers + " workers");
            assertEquals(workers, stats.idleWorkers(), "All workers should be idle once ready");
            assertEquals(0.0, stats.utilizationRate());
            assertFalse(pool.isFallbackActive());
        }
    }

    @Test
    public void testProcess_ResultsAlignedWithInputOrder() throws Exception {
        // Arrange - earlier tasks sleep longer, so they complete last
        WorkerPool<Integer, Integer> pool = startPool(config(4));
        List<Task<Integer>> tasks = IntStream.range(0, 20)
            .mapToObj(i -> new Task<>("task-" + i, "sleep", (20 - i) * 5))
            .collect(Collectors.toList());

        // Act
        List<TaskResult<Integer>> results = pool.process(tasks).join();

        // Assert
        assertEquals(tasks.size(), results.size(), "One result per task");
        for (int i = 0; i < tasks.size(); i++) {
            assertEquals(tasks.get(i).id(), results.get(i).taskId(), "Result " + i + " should match its task");
            assertTrue(results.get(i).success());
            assertEquals(tasks.get(i).data(), results.get(i).data());
        }
    }

    @Test
    public void testWithAccumulation_ReturnsAggregatedResult() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(4));
        List<Task<Integer>> tasks = IntStream.range(0, 50)
            .mapToObj(i -> new Task<>("n-" + i, "double", i))
            .collect(Collectors.toList());
        int expectedSum = IntStream.range(0, 50).sum();

        // Act
        int sum = pool.process(tasks).join().stream()
            .mapToInt(TaskResult::data)
            .sum();

        // Assert
        assertEquals(expectedSum * 2, sum, "Sum of doubled numbers should match");
        assertEquals(50, pool.getStats().totalTasksProcessed());
    }

    @Test
    public void testTimeout_FailsTaskAndKeepsWorkerCount() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(2).withTaskTimeoutMs(200));
        AtomicInteger timeouts = new AtomicInteger(0);
        pool.addListener(new PoolListener() {
            @Override
            public void onTaskTimeout(String taskId, int workerId) {
                timeouts.incrementAndGet();
            }
        });

        // Act
        TaskResult<Integer> result = pool.submit(new Task<>("slow", "sleep", 5_000)).join();

        // Assert
        assertFalse(result.success());
        assertTrue(result.error().toLowerCase().contains("timeout"), "Error should mention timeout: " + result.error());
        assertEquals(1, timeouts.get());
        assertEquals(2, pool.getStats().totalWorkers(), "Timeout must not shrink the pool");

        TaskResult<Integer> next = pool.submit(new Task<>("after", "double", 21)).join();
        assertTrue(next.success(), "Pool should keep serving tasks after a timeout");
        assertEquals(42, next.data());
    }

    @Test
    public void testWorkerCrash_TaskFailsAndPoolSelfHeals() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(2));

        // Act
        TaskResult<Integer> crashed = pool.submit(new Task<>("boom", "crash", 0)).join();
        List<TaskResult<Integer>> after = pool.process(IntStream.range(0, 10)
            .mapToObj(i -> new Task<>("after-" + i, "double", i))
            .collect(Collectors.toList())).join();

        // Assert
        assertFalse(crashed.success());
        assertTrue(crashed.error().contains("crashed"), "Error should describe the crash: " + crashed.error());
        assertTrue(after.stream().allMatch(TaskResult::success), "Tasks after a crash should succeed");
        PoolStats stats = pool.getStats();
        assertEquals(2, stats.totalWorkers(), "Crash must not shrink the pool");
        assertTrue(stats.restarts() >= 1, "Crashed worker should have been replaced");
    }

    @Test
    public void testSimultaneousCrashes_EachRecoveredIndependently() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(3));
        List<Task<Integer>> crashes = IntStream.range(0, 3)
            .mapToObj(i -> new Task<>("boom-" + i, "crash", i))
            .collect(Collectors.toList());

        // Act
        List<TaskResult<Integer>> crashed = pool.process(crashes).join();
        List<TaskResult<Integer>> after = pool.process(IntStream.range(0, 6)
            .mapToObj(i -> new Task<>("after-" + i, "double", i))
            .collect(Collectors.toList())).join();

        // Assert
        assertTrue(crashed.stream().noneMatch(TaskResult::success));
        assertTrue(after.stream().allMatch(TaskResult::success));
        assertEquals(3, pool.getStats().totalWorkers());
    }

    @Test
    public void testPriority_SingleWorkerRunsHighestFirst() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(1));
        List<Task<Integer>> tasks = List.of(
            new Task<>("p1", "record", 1, 1),
            new Task<>("p10", "record", 10, 10),
            new Task<>("p5", "record", 5, 5));

        // Act
        List<TaskResult<Integer>> results = pool.process(tasks).join();

        // Assert
        assertEquals(List.of(10, 5, 1), executionOrder, "Highest priority should run first");
        assertEquals(List.of("p1", "p10", "p5"), results.stream().map(TaskResult::taskId).toList(),
            "Results should still follow input order");
    }

    @Test
    public void testUnknownType_ResolvesAsFailure() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(1));

        // Act
        TaskResult<Integer> result = pool.submit(new Task<>("mystery", "no-such-type", 1)).join();

        // Assert
        assertFalse(result.success());
        assertEquals("Unknown task type: no-such-type", result.error());
        assertEquals(1, pool.getStats().totalWorkers());
        assertEquals(0, pool.getStats().restarts(), "An unknown type is not a crash");
    }

    @Test
    public void testHandlerException_ResolvesAsFailureWithMessage() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(2));

        // Act
        TaskResult<Integer> result = pool.submit(new Task<>("bad", "fail", 7)).join();

        // Assert
        assertFalse(result.success());
        assertEquals("Simulated failure for 7", result.error());
        assertTrue(result.workerId() >= 0);
    }

    @Test
    public void testTransientFailures_RecoverWithRetries() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(2));

        // Act
        TaskResult<Integer> result = pool.submit(new Task<>("flaky", "flaky", 3, 0, 2)).join();

        // Assert
        assertTrue(result.success(), "Task should succeed on its third attempt");
        assertEquals(3, attemptCounts.get(3).get(), "Task should have 3 attempts");
    }

    @Test
    public void testShutdown_FastTasksFinishBeforeGraceDeadline() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(2).withShutdownGraceMs(5_000));
        CompletableFuture<TaskResult<Integer>> inFlight = pool.submit(new Task<>("quick", "sleep", 100));
        Thread.sleep(20);

        // Act
        long start = System.currentTimeMillis();
        pool.shutdown();
        long elapsed = System.currentTimeMillis() - start;

        // Assert
        assertTrue(elapsed < 5_000, "Shutdown should not wait for the full grace period, took " + elapsed + "ms");
        assertTrue(inFlight.join().success(), "In-flight task should be allowed to finish");
        assertEquals(0, pool.getStats().totalWorkers());
    }

    @Test
    public void testShutdown_SlowTaskForceTerminatedAfterGrace() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(1).withShutdownGraceMs(300));
        CompletableFuture<TaskResult<Integer>> inFlight = pool.submit(new Task<>("stuck", "sleep", 10_000));
        Thread.sleep(100);

        // Act
        long start = System.currentTimeMillis();
        pool.shutdown();
        long elapsed = System.currentTimeMillis() - start;

        // Assert
        assertTrue(elapsed >= 250, "Shutdown should wait for the grace period, took " + elapsed + "ms");
        assertTrue(elapsed < 2_300, "Shutdown should force termination soon after the grace period, took " + elapsed + "ms");
        TaskResult<Integer> result = inFlight.join();
        assertFalse(result.success());
        assertTrue(result.error().contains("terminated"), result.error());
        assertEquals(0, pool.getStats().totalWorkers());
    }

    @Test
    public void testShutdown_DiscardsQueuedTasks() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(1));
        List<CompletableFuture<TaskResult<Integer>>> futures = IntStream.range(0, 5)
            .mapToObj(i -> pool.submit(new Task<>("slow-" + i, "sleep", 200)))
            .collect(Collectors.toList());
        Thread.sleep(50);

        // Act
        pool.shutdown();

        // Assert
        List<TaskResult<Integer>> results = futures.stream().map(CompletableFuture::join).toList();
        assertTrue(results.get(0).success(), "Running task should complete");
        for (TaskResult<Integer> discarded : results.subList(1, results.size())) {
            assertFalse(discarded.success());
            assertTrue(discarded.error().contains("discarded"), discarded.error());
        }
    }

    @Test
    public void testSubmitBeforeInitializeOrAfterShutdown_Throws() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> notStarted = new WorkerPool<>(config(1), handlers());
        pools.add(notStarted);
        WorkerPool<Integer, Integer> stopped = startPool(config(1));
        stopped.shutdown();

        // Act & Assert
        assertThrows(IllegalStateException.class, () -> notStarted.submit(new Task<>("a", "double", 1)));
        assertThrows(IllegalStateException.class, () -> stopped.submit(new Task<>("b", "double", 1)));
    }

    @Test
    public void testDuplicateIds_Rejected() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(1));
        List<Task<Integer>> tasks = List.of(new Task<>("same", "double", 1), new Task<>("same", "double", 2));

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> pool.process(tasks));
    }

    @Test
    public void testThreadFactoryFailure_FallsBackToInlineExecution() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = new WorkerPool<>(config(2), handlers(), runnable -> {
            throw new IllegalStateException("no threads for you");
        });
        pools.add(pool);

        // Act
        pool.initialize();
        List<TaskResult<Integer>> results = pool.process(List.of(
            new Task<>("a", "double", 1),
            new Task<>("b", "fail", 2))).join();

        // Assert
        assertTrue(pool.isFallbackActive(), "Pool should fall back when workers cannot start");
        assertTrue(results.get(0).success());
        assertEquals(2, results.get(0).data());
        assertFalse(results.get(1).success());
        assertEquals(TaskResult.NO_WORKER_ID, results.get(0).workerId());
    }

    @Test
    public void testListener_ReceivesLifecycleEvents() throws Exception {
        // Arrange
        AtomicInteger readyWorkers = new AtomicInteger(0);
        AtomicInteger completed = new AtomicInteger(0);
        AtomicInteger batches = new AtomicInteger(0);
        AtomicInteger shutdowns = new AtomicInteger(0);
        WorkerPool<Integer, Integer> pool = new WorkerPool<>(config(3), handlers());
        pools.add(pool);
        pool.addListener(new PoolListener() {
            @Override
            public void onReady(int workerCount) {
                readyWorkers.set(workerCount);
            }

            @Override
            public void onTaskComplete(TaskResult<?> result) {
                completed.incrementAndGet();
            }

            @Override
            public void onBatchComplete(int taskCount, long durationMs) {
                batches.incrementAndGet();
            }

            @Override
            public void onShutdown() {
                shutdowns.incrementAndGet();
            }
        });

        // Act
        pool.initialize();
        pool.process(IntStream.range(0, 8)
            .mapToObj(i -> new Task<>("t-" + i, "double", i))
            .collect(Collectors.toList())).join();
        pool.shutdown();

        // Assert
        assertEquals(3, readyWorkers.get());
        assertEquals(8, completed.get());
        assertEquals(1, batches.get());
        assertEquals(1, shutdowns.get());
    }

    @Test
    public void testGetStats_ReportsBusyWorkersWhileRunning() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(2));
        CompletableFuture<List<TaskResult<Integer>>> batch = pool.process(List.of(
            new Task<>("a", "sleep", 500),
            new Task<>("b", "sleep", 500),
            new Task<>("c", "sleep", 10)));
        Thread.sleep(150);

        // Act
        PoolStats running = pool.getStats();
        List<WorkerState> states = pool.getWorkerStates();
        batch.join();
        PoolStats done = pool.getStats();

        // Assert
        assertEquals(2, running.busyWorkers());
        assertEquals(2, running.activeTasks(), "Only assigned tasks count as active");
        assertEquals(1, running.queueLength());
        assertEquals(1.0, running.utilizationRate());
        assertTrue(states.stream().allMatch(state -> state.status() == WorkerStatus.BUSY));
        assertEquals(0, done.busyWorkers());
        assertEquals(3, done.totalTasksProcessed());
    }

    @Test
    public void testShortLivedAllocations_DoNotRestartWorker() throws Exception {
        // Arrange - total allocation far exceeds the per-worker budget, but nothing stays live
        WorkerPool<Integer, Integer> pool = startPool(config(1).withMemoryLimitMB(64));
        List<Task<Integer>> tasks = IntStream.range(0, 12)
            .mapToObj(i -> new Task<>("alloc-" + i, "allocate", 16))
            .collect(Collectors.toList());

        // Act
        List<TaskResult<Integer>> results = pool.process(tasks).join();
        PoolStats stats = pool.getStats();

        // Assert
        assertTrue(results.stream().allMatch(TaskResult::success));
        assertEquals(0, stats.restarts(), "A healthy worker must not be replaced");
        assertEquals(12, pool.getWorkerStates().get(0).tasksCompleted(), "The same worker should run every task");
        assertTrue(stats.memoryUsageMB() > 0, "Heap usage should be reported");
        assertTrue(stats.memoryUsageMB() <= Runtime.getRuntime().maxMemory() / (1024 * 1024));
    }

    @Test
    public void testOutOfMemory_WorkerReplacedLikeCrash() throws Exception {
        // Arrange
        WorkerPool<Integer, Integer> pool = startPool(config(1));

        // Act
        TaskResult<Integer> exhausted = pool.submit(new Task<>("oom", "exhaust", 0)).join();
        TaskResult<Integer> next = pool.submit(new Task<>("after", "double", 5)).join();

        // Assert
        assertFalse(exhausted.success());
        assertTrue(exhausted.error().contains("OutOfMemoryError"), exhausted.error());
        assertTrue(next.success(), "Replacement worker should serve later tasks");
        assertEquals(1, pool.getStats().restarts());
        assertEquals(1, pool.getStats().totalWorkers());
    }
}
