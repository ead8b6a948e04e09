package com.carsales.taskservice.task.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a task. Transitions only move forward:
 * pending to in_progress to completed or failed, and pending straight to failed
 * when a task is rejected or orphaned before it starts.
 */
public enum TaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Task status is required");
        }
        return TaskStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * States a task must currently be in for a transition into this state to apply.
     */
    public Set<TaskStatus> allowedPredecessors() {
        return switch (this) {
            case PENDING -> EnumSet.noneOf(TaskStatus.class);
            case IN_PROGRESS -> EnumSet.of(PENDING);
            case COMPLETED -> EnumSet.of(IN_PROGRESS);
            case FAILED -> EnumSet.of(PENDING, IN_PROGRESS);
        };
    }
}
