package com.carsales.taskservice.task.persistence;

import com.carsales.taskservice.task.model.TaskMeta;
import com.carsales.taskservice.task.model.TaskStatus;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class TaskJdbcRepository {
    private static final RowMapper<TaskMeta> TASK_ROW = (rs, rowNum) -> new TaskMeta(
        rs.getLong("id"),
        rs.getString("filters"),
        TaskStatus.fromWire(rs.getString("status")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("completed_at")),
        rs.getString("error_message")
    );

    private final NamedParameterJdbcTemplate jdbc;

    public TaskJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public TaskMeta create(String filtersJson, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("filters", filtersJson, Types.VARCHAR)
            .addValue("status", TaskStatus.PENDING.wireValue())
            .addValue("createdAt", Timestamp.from(createdAt));
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO tasks (filters, status, created_at)
                VALUES (:filters, :status, :createdAt)
                """,
            params,
            keyHolder,
            new String[] {"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Task insert returned no generated id");
        }
        return new TaskMeta(key.longValue(), filtersJson, TaskStatus.PENDING, createdAt, null, null);
    }

    public TaskMeta findById(long taskId) {
        List<TaskMeta> rows = jdbc.query(
            """
                SELECT id, filters, status, created_at, completed_at, error_message
                FROM tasks
                WHERE id = :id
                """,
            new MapSqlParameterSource().addValue("id", taskId),
            TASK_ROW
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Moves a task into {@code target} in a single statement, writing the terminal field
     * alongside the status. Applies only while the task sits in one of the target's
     * allowed predecessor states.
     *
     * @return true when the row was updated
     */
    public boolean transition(long taskId, TaskStatus target, Instant completedAt, String errorMessage) {
        Set<TaskStatus> predecessors = target.allowedPredecessors();
        if (predecessors.isEmpty()) {
            throw new IllegalArgumentException("No transition leads into " + target.wireValue());
        }
        Instant safeCompletedAt = target == TaskStatus.COMPLETED ? completedAt : null;
        String safeError = target == TaskStatus.FAILED ? errorMessage : null;
        if (target == TaskStatus.COMPLETED && safeCompletedAt == null) {
            throw new IllegalArgumentException("completedAt is required when completing a task");
        }
        if (target == TaskStatus.FAILED && (safeError == null || safeError.isBlank())) {
            throw new IllegalArgumentException("errorMessage is required when failing a task");
        }
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", taskId)
            .addValue("status", target.wireValue())
            .addValue("completedAt", safeCompletedAt == null ? null : Timestamp.from(safeCompletedAt), Types.TIMESTAMP)
            .addValue("errorMessage", safeError, Types.VARCHAR)
            .addValue("predecessors", predecessors.stream().map(TaskStatus::wireValue).toList());
        int updated = jdbc.update(
            """
                UPDATE tasks
                SET status = :status,
                    completed_at = :completedAt,
                    error_message = :errorMessage
                WHERE id = :id
                  AND status IN (:predecessors)
                """,
            params
        );
        return updated > 0;
    }

    public boolean markInProgress(long taskId) {
        return transition(taskId, TaskStatus.IN_PROGRESS, null, null);
    }

    public boolean markCompleted(long taskId, Instant completedAt) {
        return transition(taskId, TaskStatus.COMPLETED, completedAt, null);
    }

    public boolean markFailed(long taskId, String errorMessage) {
        return transition(taskId, TaskStatus.FAILED, null, errorMessage);
    }

    public List<TaskMeta> findUnfinishedCreatedBefore(Instant cutoff) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("cutoff", Timestamp.from(cutoff))
            .addValue("statuses", List.of(TaskStatus.PENDING.wireValue(), TaskStatus.IN_PROGRESS.wireValue()));
        return jdbc.query(
            """
                SELECT id, filters, status, created_at, completed_at, error_message
                FROM tasks
                WHERE status IN (:statuses)
                  AND created_at < :cutoff
                ORDER BY id ASC
                """,
            params,
            TASK_ROW
        );
    }

    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        jdbc.query(
            """
                SELECT status, COUNT(*) AS total
                FROM tasks
                GROUP BY status
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(TaskStatus.fromWire(rs.getString("status")), rs.getLong("total"));
            }
        );
        return counts;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
