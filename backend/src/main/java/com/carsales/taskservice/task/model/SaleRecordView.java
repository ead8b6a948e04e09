package com.carsales.taskservice.task.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.LocalDateTime;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SaleRecordView(
    long id,
    long taskId,
    String company,
    String name,
    Double mpg,
    Integer cylinders,
    Double displacement,
    Double horsepower,
    Double weight,
    Double acceleration,
    LocalDateTime saleDate,
    Integer price,
    String origin
) {
}
