package com.carsales.taskservice.task.service;

import com.carsales.taskservice.task.model.TaskView;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class TaskQueueFullException extends RuntimeException {
    private final TaskView task;

    public TaskQueueFullException(TaskView task) {
        super("Queue is full, task " + task.id() + " was not accepted");
        this.task = task;
    }

    public TaskView getTask() {
        return task;
    }
}
