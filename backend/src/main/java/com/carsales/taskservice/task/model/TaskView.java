package com.carsales.taskservice.task.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskView(
    long id,
    JsonNode filters,
    TaskStatus status,
    Instant createdAt,
    Instant completedAt,
    String errorMessage
) {
}
