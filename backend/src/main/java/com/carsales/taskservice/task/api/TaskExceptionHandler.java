package com.carsales.taskservice.task.api;

import com.carsales.taskservice.task.filter.InvalidFilterException;
import com.carsales.taskservice.task.service.InvalidTaskRequestException;
import com.carsales.taskservice.task.service.TaskNotFoundException;
import com.carsales.taskservice.task.service.TaskQueueFullException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class TaskExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(TaskExceptionHandler.class);

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidFilters(InvalidFilterException ex) {
        return error(HttpStatus.BAD_REQUEST, "Invalid filters format", ex.getMessage());
    }

    @ExceptionHandler(InvalidTaskRequestException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(InvalidTaskRequestException ex) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", "Request body is not valid JSON");
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(TaskNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "Not found", "Task not found");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleBadTaskId(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.NOT_FOUND, "Not found", "Task not found");
    }

    @ExceptionHandler(TaskQueueFullException.class)
    public ResponseEntity<Map<String, Object>> handleQueueFull(TaskQueueFullException ex) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Queue full");
        body.put("message", "Server is busy, please try again later");
        body.put("task", ex.getTask());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleDataAccess(DataAccessException ex) {
        log.error("Persistence failure while handling request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Server error", ex.getMostSpecificCause().getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return ResponseEntity.status(status).body(body);
    }
}
