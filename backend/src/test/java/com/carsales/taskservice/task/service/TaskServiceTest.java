package com.carsales.taskservice.task.service;

import com.carsales.taskservice.task.filter.InvalidFilterException;
import com.carsales.taskservice.task.model.HealthResponse;
import com.carsales.taskservice.task.model.SaleRecordView;
import com.carsales.taskservice.task.model.TaskDetailResponse;
import com.carsales.taskservice.task.model.TaskMeta;
import com.carsales.taskservice.task.model.TaskReference;
import com.carsales.taskservice.task.model.TaskStatus;
import com.carsales.taskservice.task.model.TaskView;
import com.carsales.taskservice.task.persistence.SaleRecordJdbcRepository;
import com.carsales.taskservice.task.persistence.TaskJdbcRepository;
import com.carsales.taskservice.task.queue.TaskQueue;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {
    private static final Instant CREATED = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private TaskJdbcRepository taskRepository;

    @Mock
    private SaleRecordJdbcRepository recordRepository;

    @Mock
    private TaskWorkerService workerService;

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void submitStoresFiltersVerbatimAndEnqueues() throws Exception {
        TaskQueue queue = new TaskQueue(2);
        String filters = "{\"carBrands\":[\"Toyota\"],\"color\":\"red\"}";
        when(taskRepository.create(eq(filters), any(Instant.class)))
            .thenReturn(new TaskMeta(1L, filters, TaskStatus.PENDING, CREATED, null, null));

        TaskView view = service(queue).submitTask(objectMapper.readTree(filters));

        assertThat(view.id()).isEqualTo(1L);
        assertThat(view.status()).isEqualTo(TaskStatus.PENDING);
        assertThat(view.filters().get("color").asText()).isEqualTo("red");
        TaskReference queued = queue.poll(Duration.ofMillis(10));
        assertThat(queued.taskId()).isEqualTo(1L);
        assertThat(queued.filters().carBrands()).containsExactly("Toyota");
    }

    @Test
    void submitWithoutFiltersStoresNull() {
        TaskQueue queue = new TaskQueue(2);
        when(taskRepository.create(isNull(), any(Instant.class)))
            .thenReturn(new TaskMeta(2L, null, TaskStatus.PENDING, CREATED, null, null));

        TaskView view = service(queue).submitTask(null);

        assertThat(view.filters()).isNull();
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void malformedFiltersAreRejectedBeforeAnyTaskIsCreated() {
        TaskQueue queue = new TaskQueue(2);

        assertThrows(InvalidFilterException.class, () -> service(queue).submitTask(new TextNode("Toyota")));

        verifyNoInteractions(taskRepository);
        assertThat(queue.size()).isZero();
    }

    @Test
    void fullQueueFailsTheNewTask() {
        TaskQueue queue = new TaskQueue(1);
        when(taskRepository.create(isNull(), any(Instant.class)))
            .thenReturn(new TaskMeta(1L, null, TaskStatus.PENDING, CREATED, null, null))
            .thenReturn(new TaskMeta(2L, null, TaskStatus.PENDING, CREATED, null, null));
        when(taskRepository.markFailed(2L, "Queue is full")).thenReturn(true);
        when(taskRepository.findById(2L))
            .thenReturn(new TaskMeta(2L, null, TaskStatus.FAILED, CREATED, null, "Queue is full"));
        TaskService service = service(queue);

        service.submitTask(null);
        TaskQueueFullException ex = assertThrows(TaskQueueFullException.class, () -> service.submitTask(null));

        assertThat(ex.getTask().id()).isEqualTo(2L);
        assertThat(ex.getTask().status()).isEqualTo(TaskStatus.FAILED);
        assertThat(ex.getTask().errorMessage()).isEqualTo("Queue is full");
        assertThat(queue.size()).isEqualTo(1);
        verify(taskRepository).markFailed(2L, "Queue is full");
    }

    @Test
    void unknownTaskIsNotFound() {
        when(taskRepository.findById(42L)).thenReturn(null);

        TaskNotFoundException ex = assertThrows(TaskNotFoundException.class, () -> service(new TaskQueue(1)).fetchTask(42L));

        assertThat(ex.getTaskId()).isEqualTo(42L);
    }

    @Test
    void unfinishedTaskCarriesNoData() {
        when(taskRepository.findById(3L))
            .thenReturn(new TaskMeta(3L, "{\"carBrands\":[\"Ford\"]}", TaskStatus.IN_PROGRESS, CREATED, null, null));

        TaskDetailResponse detail = service(new TaskQueue(1)).fetchTask(3L);

        assertThat(detail.status()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(detail.data()).isNull();
        assertThat(detail.filters().get("carBrands").get(0).asText()).isEqualTo("Ford");
        verifyNoInteractions(recordRepository);
    }

    @Test
    void completedTaskCarriesItsRecords() {
        Instant completed = CREATED.plusSeconds(5);
        when(taskRepository.findById(4L))
            .thenReturn(new TaskMeta(4L, null, TaskStatus.COMPLETED, CREATED, completed, null));
        SaleRecordView record = new SaleRecordView(10L, 4L, "Ford", "pinto", 25.0, 4, 98.0, null, 2046.0, 19.0,
            LocalDateTime.of(1974, 1, 1, 0, 0), 2000, "usa");
        when(recordRepository.findByTaskId(4L)).thenReturn(List.of(record));

        TaskDetailResponse detail = service(new TaskQueue(1)).fetchTask(4L);

        assertThat(detail.completedAt()).isEqualTo(completed);
        assertThat(detail.data()).containsExactly(record);
    }

    @Test
    void healthReflectsWorkerAndQueue() {
        TaskQueue queue = new TaskQueue(5);
        Instant lastPoll = Instant.parse("2024-03-01T10:00:01Z");
        when(workerService.isAlive()).thenReturn(true);
        when(workerService.getLastPollAt()).thenReturn(lastPoll);

        HealthResponse health = service(queue).health();

        assertThat(health.status()).isEqualTo("healthy");
        assertThat(health.queueSize()).isZero();
        assertThat(health.queueCapacity()).isEqualTo(5);
        assertThat(health.workerActive()).isTrue();
        assertThat(health.lastPollAt()).isEqualTo(lastPoll);
    }

    @Test
    void deadWorkerDegradesHealth() {
        when(workerService.isAlive()).thenReturn(false);

        HealthResponse health = service(new TaskQueue(5)).health();

        assertThat(health.status()).isEqualTo("degraded");
        assertThat(health.workerActive()).isFalse();
    }

    @Test
    void stalledWorkerDegradesHealth() {
        when(workerService.isAlive()).thenReturn(true);
        when(workerService.isStalled()).thenReturn(true);

        HealthResponse health = service(new TaskQueue(5)).health();

        assertThat(health.status()).isEqualTo("degraded");
        assertThat(health.workerActive()).isTrue();
    }

    private TaskService service(TaskQueue queue) {
        return new TaskService(taskRepository, recordRepository, queue, workerService, objectMapper);
    }
}
