package com.carsales.taskservice.task.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HealthResponse(
    String status,
    int queueSize,
    int queueCapacity,
    boolean workerActive,
    Instant lastPollAt
) {
}
