package com.carsales.taskservice.task.queue;

import com.carsales.taskservice.task.filter.FilterSpec;
import com.carsales.taskservice.task.model.TaskReference;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskQueueTest {

    @Test
    void offerRejectsBeyondCapacityWithoutBlocking() {
        TaskQueue queue = new TaskQueue(2);
        assertTrue(queue.offer(reference(1)));
        assertTrue(queue.offer(reference(2)));

        long start = System.nanoTime();
        assertFalse(queue.offer(reference(3)));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 500);
        assertEquals(2, queue.size());
        assertEquals(2, queue.capacity());
    }

    @Test
    void pollReturnsReferencesInSubmissionOrder() throws InterruptedException {
        TaskQueue queue = new TaskQueue(5);
        queue.offer(reference(10));
        queue.offer(reference(11));
        queue.offer(reference(12));

        assertEquals(10, queue.poll(Duration.ofMillis(50)).taskId());
        assertEquals(11, queue.poll(Duration.ofMillis(50)).taskId());
        assertEquals(12, queue.poll(Duration.ofMillis(50)).taskId());
        assertEquals(0, queue.size());
    }

    @Test
    void pollTimesOutOnEmptyQueue() throws InterruptedException {
        TaskQueue queue = new TaskQueue(1);
        long start = System.nanoTime();
        assertNull(queue.poll(Duration.ofMillis(100)));
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() >= 90);
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new TaskQueue(0));
    }

    @Test
    void referenceWithoutFiltersDefaultsToUnconstrained() {
        TaskReference reference = new TaskReference(1L, null);
        assertTrue(reference.filters().isUnconstrained());
    }

    private TaskReference reference(long taskId) {
        return new TaskReference(taskId, FilterSpec.none());
    }
}
