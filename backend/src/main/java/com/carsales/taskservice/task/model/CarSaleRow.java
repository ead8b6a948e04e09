package com.carsales.taskservice.task.model;

import java.time.LocalDateTime;

public record CarSaleRow(
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
