package com.carsales.taskservice.task.api;

import com.carsales.taskservice.task.model.HealthResponse;
import com.carsales.taskservice.task.model.TaskCreatedResponse;
import com.carsales.taskservice.task.model.TaskDetailResponse;
import com.carsales.taskservice.task.model.TaskView;
import com.carsales.taskservice.task.service.TaskService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

@RestController
@RequestMapping("/api/v1")
public class TaskController {
    private static final Logger log = LoggerFactory.getLogger(TaskController.class);

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping("/tasks")
    @ResponseStatus(HttpStatus.CREATED)
    public TaskCreatedResponse createTask(@RequestBody(required = false) JsonNode body) {
        return timed("createTask", () -> {
            TaskCreateRequest request = TaskCreateRequest.fromBody(body);
            log.info("Received task creation request with filters: {}", request.filters());
            TaskView task = taskService.submitTask(request.filters());
            return new TaskCreatedResponse("Task created", task);
        });
    }

    @GetMapping("/tasks/{taskId}")
    public TaskDetailResponse getTask(@PathVariable("taskId") long taskId) {
        return timed("getTask", () -> taskService.fetchTask(taskId));
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return taskService.health();
    }

    private <T> T timed(String operation, Supplier<T> body) {
        Instant start = Instant.now();
        try {
            return body.get();
        } finally {
            log.info("{} took {} ms", operation, Duration.between(start, Instant.now()).toMillis());
        }
    }
}
