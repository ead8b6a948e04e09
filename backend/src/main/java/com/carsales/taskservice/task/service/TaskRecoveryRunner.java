package com.carsales.taskservice.task.service;

import com.carsales.taskservice.config.TaskServiceProperties;
import com.carsales.taskservice.task.model.TaskMeta;
import com.carsales.taskservice.task.model.TaskStatus;
import com.carsales.taskservice.task.persistence.SaleRecordJdbcRepository;
import com.carsales.taskservice.task.persistence.TaskJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fails tasks left pending or in_progress by a previous process. The queue lives in
 * memory, so nothing would ever pick them up again.
 */
@Component
public class TaskRecoveryRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TaskRecoveryRunner.class);
    static final String RESTART_MESSAGE = "Task interrupted by service restart; resubmit to process";

    private final TaskJdbcRepository taskRepository;
    private final SaleRecordJdbcRepository recordRepository;
    private final TaskServiceProperties properties;
    private final Instant startedAt;

    public TaskRecoveryRunner(
        TaskJdbcRepository taskRepository,
        SaleRecordJdbcRepository recordRepository,
        TaskServiceProperties properties
    ) {
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.properties = properties;
        this.startedAt = Instant.now();
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getRecovery().isEnabled()) {
            return;
        }
        boolean dbConnected;
        try {
            dbConnected = taskRepository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database check before task recovery failed: {}", e.getMessage());
            dbConnected = false;
        }
        if (!dbConnected) {
            log.warn("Skipping task recovery because database is unreachable");
            return;
        }

        List<TaskMeta> orphaned = taskRepository.findUnfinishedCreatedBefore(startedAt);
        int recovered = 0;
        for (TaskMeta task : orphaned) {
            if (taskRepository.markFailed(task.id(), RESTART_MESSAGE)) {
                int removed = task.status() == TaskStatus.IN_PROGRESS ? recordRepository.deleteByTaskId(task.id()) : 0;
                recovered++;
                log.info("Failed orphaned task {} (was {}, removed {} partial records)", task.id(), task.status().wireValue(), removed);
            }
        }
        Map<TaskStatus, Long> counts = taskRepository.countByStatus();
        log.info("Task recovery finished: {} orphaned tasks failed, current counts {}", recovered, counts);
    }
}
