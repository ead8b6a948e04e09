package com.carsales.taskservice.task.service;

import com.carsales.taskservice.config.TaskServiceProperties;
import com.carsales.taskservice.task.model.TaskReference;
import com.carsales.taskservice.task.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
public class TaskWorkerService {
    private static final Logger log = LoggerFactory.getLogger(TaskWorkerService.class);

    private final TaskQueue taskQueue;
    private final TaskProcessor taskProcessor;
    private final TaskServiceProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService loopExecutor;
    private ExecutorService processingExecutor;
    private volatile Thread workerThread;
    private volatile Instant lastPollAt;
    private volatile Long stalledTaskId;

    public TaskWorkerService(TaskQueue taskQueue, TaskProcessor taskProcessor, TaskServiceProperties properties) {
        this.taskQueue = taskQueue;
        this.taskProcessor = taskProcessor;
        this.properties = properties;
    }

    @PostConstruct
    public void startIfEnabled() {
        if (properties.getWorker().isEnabled()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            Duration pollTimeout = Duration.ofMillis(properties.getWorker().getPollTimeoutMs());
            Duration taskTimeout = Duration.ofSeconds(properties.getWorker().getTaskTimeoutSeconds());
            Duration cancelGrace = Duration.ofSeconds(properties.getWorker().getCancelGraceSeconds());
            loopExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("task-worker");
                thread.setDaemon(true);
                return thread;
            });
            processingExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("task-processor");
                thread.setDaemon(true);
                return thread;
            });
            running.set(true);
            loopExecutor.submit(() -> workerLoop(pollTimeout, taskTimeout, cancelGrace));
            log.info(
                "Task worker started (queueCapacity={}, pollTimeoutMs={}, taskTimeoutSeconds={})",
                taskQueue.capacity(),
                pollTimeout.toMillis(),
                taskTimeout.toSeconds()
            );
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get()) {
                return;
            }
            running.set(false);
            shutdown(loopExecutor);
            shutdown(processingExecutor);
            loopExecutor = null;
            processingExecutor = null;
            workerThread = null;
            stalledTaskId = null;
            log.info("Task worker stopped with {} tasks still queued", taskQueue.size());
        }
    }

    public boolean isAlive() {
        Thread thread = workerThread;
        return running.get() && thread != null && thread.isAlive();
    }

    /**
     * True while a timed-out task is still running after its cancel grace period. No other
     * task starts until it returns.
     */
    public boolean isStalled() {
        return stalledTaskId != null;
    }

    public Instant getLastPollAt() {
        return lastPollAt;
    }

    private void workerLoop(Duration pollTimeout, Duration taskTimeout, Duration cancelGrace) {
        workerThread = Thread.currentThread();
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            TaskReference reference;
            try {
                reference = taskQueue.poll(pollTimeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            lastPollAt = Instant.now();
            if (reference == null) {
                continue;
            }

            try {
                processWithTimeout(reference, taskTimeout, cancelGrace);
            } catch (InterruptedException e) {
                taskProcessor.recordFailure(reference.taskId(), "Task interrupted by worker shutdown");
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                log.error("Worker failed while processing task {}", reference.taskId(), e);
                taskProcessor.recordFailure(reference.taskId(), TaskProcessor.messageOf(e));
            }
        }
        log.info("Task worker loop exited");
    }

    private void processWithTimeout(TaskReference reference, Duration taskTimeout, Duration cancelGrace) throws Exception {
        CountDownLatch finished = new CountDownLatch(1);
        AtomicBoolean started = new AtomicBoolean(false);
        Future<?> future = processingExecutor.submit(() -> {
            started.set(true);
            try {
                taskProcessor.process(reference);
            } finally {
                finished.countDown();
            }
        });
        try {
            future.get(taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Task {} exceeded {}s, cancelling", reference.taskId(), taskTimeout.toSeconds());
            taskProcessor.recordFailure(
                reference.taskId(),
                "Task processing timed out after " + taskTimeout.toSeconds() + " seconds"
            );
            if (started.get()) {
                awaitCancelled(reference, finished, cancelGrace);
            }
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            throw e;
        }
    }

    // Blocks the loop until the cancelled task has actually returned, so tasks never overlap.
    private void awaitCancelled(TaskReference reference, CountDownLatch finished, Duration cancelGrace)
        throws InterruptedException {
        if (finished.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS)) {
            return;
        }
        stalledTaskId = reference.taskId();
        log.error(
            "Task {} ignored cancellation for {}s; worker stalled until it returns",
            reference.taskId(),
            cancelGrace.toSeconds()
        );
        try {
            while (!finished.await(cancelGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker still waiting on cancelled task {}", reference.taskId());
            }
            log.info("Cancelled task {} returned, worker resuming", reference.taskId());
        } finally {
            stalledTaskId = null;
        }
    }

    private void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdownNow();
        try {
            executor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }
}
