package com.carsales.taskservice.task.model;

import com.carsales.taskservice.task.filter.FilterSpec;

import java.util.Objects;

public record TaskReference(
    long taskId,
    FilterSpec filters
) {
    public TaskReference {
        filters = Objects.requireNonNullElse(filters, FilterSpec.none());
    }
}
