package com.carsales.taskservice.task.service;

import com.carsales.taskservice.task.filter.FilterSpec;
import com.carsales.taskservice.task.model.HealthResponse;
import com.carsales.taskservice.task.model.SaleRecordView;
import com.carsales.taskservice.task.model.TaskDetailResponse;
import com.carsales.taskservice.task.model.TaskMeta;
import com.carsales.taskservice.task.model.TaskReference;
import com.carsales.taskservice.task.model.TaskStatus;
import com.carsales.taskservice.task.model.TaskView;
import com.carsales.taskservice.task.persistence.SaleRecordJdbcRepository;
import com.carsales.taskservice.task.persistence.TaskJdbcRepository;
import com.carsales.taskservice.task.queue.TaskQueue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Service
public class TaskService {
    private static final Logger log = LoggerFactory.getLogger(TaskService.class);
    static final String QUEUE_FULL_MESSAGE = "Queue is full";

    private final TaskJdbcRepository taskRepository;
    private final SaleRecordJdbcRepository recordRepository;
    private final TaskQueue taskQueue;
    private final TaskWorkerService workerService;
    private final ObjectMapper objectMapper;

    public TaskService(
        TaskJdbcRepository taskRepository,
        SaleRecordJdbcRepository recordRepository,
        TaskQueue taskQueue,
        TaskWorkerService workerService,
        ObjectMapper objectMapper
    ) {
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.taskQueue = taskQueue;
        this.workerService = workerService;
        this.objectMapper = objectMapper;
    }

    public TaskView submitTask(JsonNode filters) {
        FilterSpec filterSpec = FilterSpec.fromJson(filters);
        String storedFilters = filters == null || filters.isNull() || filters.isMissingNode()
            ? null
            : filters.toString();

        TaskMeta created = taskRepository.create(storedFilters, Instant.now());
        log.info("Created new task with ID: {}", created.id());

        if (!taskQueue.offer(new TaskReference(created.id(), filterSpec))) {
            log.error("Queue is full, couldn't add task {}", created.id());
            taskRepository.markFailed(created.id(), QUEUE_FULL_MESSAGE);
            throw new TaskQueueFullException(toView(requireTask(created.id())));
        }
        log.info("Task {} added to queue (depth={})", created.id(), taskQueue.size());
        return toView(created);
    }

    public TaskDetailResponse fetchTask(long taskId) {
        TaskView task = toView(requireTask(taskId));
        List<SaleRecordView> data = task.status() == TaskStatus.COMPLETED
            ? recordRepository.findByTaskId(taskId)
            : null;
        return TaskDetailResponse.of(task, data);
    }

    public HealthResponse health() {
        boolean workerActive = workerService.isAlive();
        boolean healthy = workerActive && !workerService.isStalled();
        return new HealthResponse(
            healthy ? "healthy" : "degraded",
            taskQueue.size(),
            taskQueue.capacity(),
            workerActive,
            workerService.getLastPollAt()
        );
    }

    private TaskMeta requireTask(long taskId) {
        TaskMeta task = taskRepository.findById(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    private TaskView toView(TaskMeta task) {
        return new TaskView(
            task.id(),
            parseFilters(task),
            task.status(),
            task.createdAt(),
            task.completedAt(),
            task.errorMessage()
        );
    }

    private JsonNode parseFilters(TaskMeta task) {
        if (task.filtersJson() == null || task.filtersJson().isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(task.filtersJson());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored filters for task " + task.id() + " are not valid JSON", e);
        }
    }
}
