package io.github.galkahana.analysisrunner.pool;

import io.github.galkahana.analysisrunner.Task;
import io.github.galkahana.analysisrunner.TaskResult;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * Persistent execution context owning one thread. Receives tasks through its mailbox,
 * runs them one at a time and reports each result back to the pool.
 * <p>
 * A worker never inspects its own failures: if its thread dies, the exit hook installed
 * by {@link WorkerPool} notices and replaces it.
 */
@Slf4j
final class Worker<I, O> implements Runnable {

    interface Callbacks<I, O> {
        void ready(Worker<I, O> worker);

        void completed(Worker<I, O> worker, TaskResult<O> result);
    }

    private final int id;
    private final TaskRunner<I, O> runner;
    private final Callbacks<I, O> callbacks;
    private final BlockingQueue<Task<I>> mailbox = new LinkedBlockingQueue<>();

    private volatile Thread thread;
    private volatile boolean retired = false;

    Worker(int id, TaskRunner<I, O> runner, Callbacks<I, O> callbacks) {
        this.id = id;
        this.runner = runner;
        this.callbacks = callbacks;
    }

    void attach(Thread thread) {
        this.thread = thread;
    }

    void assign(Task<I> task) {
        mailbox.add(task);
    }

    boolean isRetired() {
        return retired;
    }

    /**
     * Stop taking work. Interrupts a running handler; any result it still produces is dropped.
     */
    void retire() {
        retired = true;
        Thread current = thread;
        if (current != null) current.interrupt();
    }

    @Override
    public void run() {
        callbacks.ready(this);
        try {
            while (!retired) {
                Task<I> task = mailbox.take();
                TaskResult<O> result = runner.run(task, id);
                if (!retired) {
                    callbacks.completed(this, result);
                }
            }
        } catch (InterruptedException e) {
            log.debug("Worker {} interrupted", id);
            Thread.currentThread().interrupt();
        }
    }
}
