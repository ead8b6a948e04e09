package com.carsales.taskservice.task.api;

import com.carsales.taskservice.task.service.InvalidTaskRequestException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Submission body. Only {@code filters} is read; other top-level keys are ignored.
 */
public record TaskCreateRequest(
    JsonNode filters
) {
    public static TaskCreateRequest fromBody(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode() || (body.isContainerNode() && body.isEmpty())) {
            throw new InvalidTaskRequestException("No JSON data provided");
        }
        if (!body.isObject()) {
            throw new InvalidTaskRequestException("Request body must be a JSON object");
        }
        return new TaskCreateRequest(body.get("filters"));
    }
}
