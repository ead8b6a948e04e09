package com.carsales.taskservice.task.service;

import com.carsales.taskservice.config.TaskServiceProperties;
import com.carsales.taskservice.task.dataset.DatasetSource;
import com.carsales.taskservice.task.dataset.DatasetUnavailableException;
import com.carsales.taskservice.task.filter.CarSaleFilterEngine;
import com.carsales.taskservice.task.model.CarSaleRow;
import com.carsales.taskservice.task.model.TaskMeta;
import com.carsales.taskservice.task.model.TaskReference;
import com.carsales.taskservice.task.model.TaskStatus;
import com.carsales.taskservice.task.persistence.SaleRecordJdbcRepository;
import com.carsales.taskservice.task.persistence.TaskJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Runs one dequeued task through load, filter and materialize, driving its status from
 * in_progress to a terminal state. Every failure inside a task ends as a failed status;
 * nothing here is retried.
 */
@Component
public class TaskProcessor {
    private static final Logger log = LoggerFactory.getLogger(TaskProcessor.class);

    private final TaskJdbcRepository taskRepository;
    private final SaleRecordJdbcRepository recordRepository;
    private final DatasetSource datasetSource;
    private final CarSaleFilterEngine filterEngine;
    private final TaskServiceProperties properties;

    public TaskProcessor(
        TaskJdbcRepository taskRepository,
        SaleRecordJdbcRepository recordRepository,
        DatasetSource datasetSource,
        CarSaleFilterEngine filterEngine,
        TaskServiceProperties properties
    ) {
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.datasetSource = datasetSource;
        this.filterEngine = filterEngine;
        this.properties = properties;
    }

    public void process(TaskReference reference) {
        long taskId = reference.taskId();
        log.info("Processing task {} with filters: {}", taskId, reference.filters());

        TaskMeta task = taskRepository.findById(taskId);
        if (task == null) {
            log.error("Task {} not found, dropping queue entry", taskId);
            return;
        }
        if (!taskRepository.markInProgress(taskId)) {
            log.warn("Task {} is {} and cannot start, skipping", taskId, task.status().wireValue());
            return;
        }
        log.info("Task {} status updated to in_progress", taskId);

        List<CarSaleRow> rows;
        try {
            log.debug("Loading dataset for task {} from {}", taskId, datasetSource.location());
            rows = datasetSource.load();
        } catch (DatasetUnavailableException e) {
            log.error("Task {} failed: {}", taskId, e.getMessage());
            fail(taskId, e.getMessage());
            return;
        }

        try {
            List<CarSaleRow> filtered = filterEngine.apply(rows, reference.filters());
            int written = writeRecords(taskId, filtered);
            log.info("Created {} records for task {}", written, taskId);

            if (taskRepository.markCompleted(taskId, Instant.now())) {
                log.info("Task {} completed successfully", taskId);
            } else {
                int removed = recordRepository.deleteByTaskId(taskId);
                log.warn("Task {} was no longer in progress at completion, removed {} records", taskId, removed);
            }
        } catch (Exception e) {
            log.error("Error processing task {}", taskId, e);
            recordFailure(taskId, messageOf(e));
        }
    }

    /**
     * Fails the task and drops any records already written for it. Errors while doing so
     * are logged so the caller's loop keeps running.
     */
    public void recordFailure(long taskId, String errorMessage) {
        try {
            fail(taskId, errorMessage);
            TaskMeta current = taskRepository.findById(taskId);
            if (current != null && current.status() == TaskStatus.FAILED) {
                int removed = recordRepository.deleteByTaskId(taskId);
                if (removed > 0) {
                    log.info("Removed {} partial records for failed task {}", removed, taskId);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to record failure for task {}", taskId, e);
        }
    }

    private int writeRecords(long taskId, List<CarSaleRow> rows) {
        int batchSize = properties.getWorker().getBatchSize();
        int written = 0;
        for (int start = 0; start < rows.size(); start += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Processing interrupted after " + written + " records");
            }
            int end = Math.min(rows.size(), start + batchSize);
            written += recordRepository.insertBatch(taskId, rows.subList(start, end));
        }
        return written;
    }

    private boolean fail(long taskId, String errorMessage) {
        boolean updated = taskRepository.markFailed(taskId, errorMessage);
        if (!updated) {
            log.warn("Task {} was already terminal, failure not recorded: {}", taskId, errorMessage);
        }
        return updated;
    }

    static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }
        return message;
    }
}
