package com.carsales.taskservice.task.queue;

import com.carsales.taskservice.task.model.TaskReference;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded FIFO of task references between the submission path and the worker loop.
 *
 * <p>Producers never block: {@link #offer(TaskReference)} reports a full queue so the
 * caller can surface backpressure. The consumer waits at most the given timeout in
 * {@link #poll(Duration)}.
 */
public class TaskQueue {
    private final BlockingQueue<TaskReference> queue;
    private final int capacity;

    public TaskQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity, true);
    }

    public boolean offer(TaskReference reference) {
        return queue.offer(reference);
    }

    public TaskReference poll(Duration timeout) throws InterruptedException {
        return queue.poll(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
