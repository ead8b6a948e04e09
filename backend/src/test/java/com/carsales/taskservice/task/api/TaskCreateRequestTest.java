package com.carsales.taskservice.task.api;

import com.carsales.taskservice.task.service.InvalidTaskRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaskCreateRequestTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsFiltersAndIgnoresOtherKeys() throws Exception {
        TaskCreateRequest request = TaskCreateRequest.fromBody(
            objectMapper.readTree("{\"filters\":{\"carBrands\":[\"Ford\"]},\"clientRef\":\"abc\"}")
        );
        assertThat(request.filters().get("carBrands").get(0).asText()).isEqualTo("Ford");
    }

    @Test
    void bodyWithoutFiltersKeyHasNoFilters() throws Exception {
        assertThat(TaskCreateRequest.fromBody(objectMapper.readTree("{\"clientRef\":\"abc\"}")).filters()).isNull();
    }

    @Test
    void emptyBodiesAreRejected() throws Exception {
        InvalidTaskRequestException empty = assertThrows(
            InvalidTaskRequestException.class,
            () -> TaskCreateRequest.fromBody(objectMapper.readTree("{}"))
        );
        assertThat(empty.getMessage()).isEqualTo("No JSON data provided");
        assertThrows(InvalidTaskRequestException.class, () -> TaskCreateRequest.fromBody(null));
        assertThrows(InvalidTaskRequestException.class, () -> TaskCreateRequest.fromBody(objectMapper.readTree("[]")));
    }

    @Test
    void nonObjectBodyIsRejected() throws Exception {
        InvalidTaskRequestException ex = assertThrows(
            InvalidTaskRequestException.class,
            () -> TaskCreateRequest.fromBody(objectMapper.readTree("[\"Toyota\"]"))
        );
        assertThat(ex.getMessage()).isEqualTo("Request body must be a JSON object");
    }
}
