package com.carsales.taskservice.task.model;

import java.time.Instant;

public record TaskMeta(
    long id,
    String filtersJson,
    TaskStatus status,
    Instant createdAt,
    Instant completedAt,
    String errorMessage
) {
}
