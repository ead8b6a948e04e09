package com.carsales.taskservice.task.filter;

import com.carsales.taskservice.task.model.CarSaleRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

@Component
public class CarSaleFilterEngine {
    private static final Logger log = LoggerFactory.getLogger(CarSaleFilterEngine.class);

    public List<CarSaleRow> apply(List<CarSaleRow> rows, FilterSpec filters) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        if (filters == null || filters.isUnconstrained()) {
            return List.copyOf(rows);
        }
        log.info("Applying filters: {}", filters);
        List<CarSaleRow> retained = rows.stream()
            .filter(row -> matches(row, filters))
            .toList();
        log.info("Applied filters, {} of {} records remaining", retained.size(), rows.size());
        return retained;
    }

    public boolean matches(CarSaleRow row, FilterSpec filters) {
        if (filters.hasDateConstraint()) {
            if (row.saleDate() == null) {
                return false;
            }
            LocalDate saleDay = row.saleDate().toLocalDate();
            if (filters.startDate() != null && saleDay.isBefore(filters.startDate())) {
                return false;
            }
            if (filters.endDate() != null && saleDay.isAfter(filters.endDate())) {
                return false;
            }
        }
        if (filters.hasBrandConstraint()) {
            return row.company() != null && filters.carBrands().contains(row.company());
        }
        return true;
    }
}
