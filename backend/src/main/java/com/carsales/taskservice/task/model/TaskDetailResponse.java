package com.carsales.taskservice.task.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TaskDetailResponse(
    long id,
    JsonNode filters,
    TaskStatus status,
    Instant createdAt,
    Instant completedAt,
    String errorMessage,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    List<SaleRecordView> data
) {
    public static TaskDetailResponse of(TaskView task, List<SaleRecordView> data) {
        return new TaskDetailResponse(
            task.id(),
            task.filters(),
            task.status(),
            task.createdAt(),
            task.completedAt(),
            task.errorMessage(),
            data
        );
    }
}
