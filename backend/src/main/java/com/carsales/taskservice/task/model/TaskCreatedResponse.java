package com.carsales.taskservice.task.model;

public record TaskCreatedResponse(
    String message,
    TaskView task
) {
}
