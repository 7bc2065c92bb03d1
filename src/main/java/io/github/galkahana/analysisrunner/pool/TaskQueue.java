package io.github.galkahana.analysisrunner.pool;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.function.ToIntFunction;

/**
 * Priority-ordered holding area for work awaiting a free worker.
 * <p>
 * Strictly higher priorities are dequeued first; equal priorities keep insertion order.
 * Not thread-safe: the owning dispatcher is the only reader and writer.
 *
 * @param <T> Queued item type
 */
public class TaskQueue<T> {

    private record Entry<T>(T item, int priority, long sequence) {}

    private static final Comparator<Entry<?>> ORDER = Comparator
            .comparingInt((Entry<?> e) -> e.priority()).reversed()
            .thenComparingLong(Entry::sequence);

    private final ToIntFunction<T> priorityOf;
    private final PriorityQueue<Entry<T>> entries = new PriorityQueue<>(ORDER);
    private long nextSequence = 0;

    public TaskQueue(ToIntFunction<T> priorityOf) {
        this.priorityOf = priorityOf;
    }

    public void enqueue(T item) {
        entries.add(new Entry<>(item, priorityOf.applyAsInt(item), nextSequence++));
    }

    /**
     * Remove the highest-priority item, or return empty when nothing is pending.
     */
    public Optional<T> dequeue() {
        Entry<T> head = entries.poll();
        return head == null ? Optional.empty() : Optional.of(head.item());
    }

    /**
     * Remove every pending item, in dequeue order.
     */
    public List<T> drain() {
        List<T> drained = new ArrayList<>(entries.size());
        for (Optional<T> next = dequeue(); next.isPresent(); next = dequeue()) {
            drained.add(next.get());
        }
        return drained;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
