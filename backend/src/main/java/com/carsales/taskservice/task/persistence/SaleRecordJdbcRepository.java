package com.carsales.taskservice.task.persistence;

import com.carsales.taskservice.task.model.CarSaleRow;
import com.carsales.taskservice.task.model.SaleRecordView;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;

@Repository
public class SaleRecordJdbcRepository {
    private static final RowMapper<SaleRecordView> RECORD_ROW = (rs, rowNum) -> new SaleRecordView(
        rs.getLong("id"),
        rs.getLong("task_id"),
        rs.getString("company"),
        rs.getString("name"),
        nullableDouble(rs, "mpg"),
        nullableInt(rs, "cylinders"),
        nullableDouble(rs, "displacement"),
        nullableDouble(rs, "horsepower"),
        nullableDouble(rs, "weight"),
        nullableDouble(rs, "acceleration"),
        rs.getTimestamp("sale_date") == null ? null : rs.getTimestamp("sale_date").toLocalDateTime(),
        nullableInt(rs, "price"),
        rs.getString("origin")
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public SaleRecordJdbcRepository(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Inserts one batch of rows for a task and commits it as a unit.
     */
    public int insertBatch(long taskId, List<CarSaleRow> rows) {
        if (rows == null || rows.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource[] batch = rows.stream()
            .map(row -> toParams(taskId, row))
            .toArray(MapSqlParameterSource[]::new);
        transactionTemplate.executeWithoutResult(status -> jdbc.batchUpdate(
            """
                INSERT INTO sale_records (
                    task_id, company, name, mpg, cylinders, displacement, horsepower,
                    weight, acceleration, sale_date, price, origin
                )
                VALUES (
                    :taskId, :company, :name, :mpg, :cylinders, :displacement, :horsepower,
                    :weight, :acceleration, :saleDate, :price, :origin
                )
                """,
            batch
        ));
        return batch.length;
    }

    public List<SaleRecordView> findByTaskId(long taskId) {
        return jdbc.query(
            """
                SELECT id, task_id, company, name, mpg, cylinders, displacement, horsepower,
                       weight, acceleration, sale_date, price, origin
                FROM sale_records
                WHERE task_id = :taskId
                ORDER BY id ASC
                """,
            new MapSqlParameterSource().addValue("taskId", taskId),
            RECORD_ROW
        );
    }

    public long countByTaskId(long taskId) {
        Long count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM sale_records
                WHERE task_id = :taskId
                """,
            new MapSqlParameterSource().addValue("taskId", taskId),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public int deleteByTaskId(long taskId) {
        return jdbc.update(
            """
                DELETE FROM sale_records
                WHERE task_id = :taskId
                """,
            new MapSqlParameterSource().addValue("taskId", taskId)
        );
    }

    private MapSqlParameterSource toParams(long taskId, CarSaleRow row) {
        return new MapSqlParameterSource()
            .addValue("taskId", taskId)
            .addValue("company", row.company(), Types.VARCHAR)
            .addValue("name", row.name(), Types.VARCHAR)
            .addValue("mpg", row.mpg(), Types.DOUBLE)
            .addValue("cylinders", row.cylinders(), Types.INTEGER)
            .addValue("displacement", row.displacement(), Types.DOUBLE)
            .addValue("horsepower", row.horsepower(), Types.DOUBLE)
            .addValue("weight", row.weight(), Types.DOUBLE)
            .addValue("acceleration", row.acceleration(), Types.DOUBLE)
            .addValue("saleDate", row.saleDate() == null ? null : Timestamp.valueOf(row.saleDate()), Types.TIMESTAMP)
            .addValue("price", row.price(), Types.INTEGER)
            .addValue("origin", row.origin(), Types.VARCHAR);
    }

    private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
