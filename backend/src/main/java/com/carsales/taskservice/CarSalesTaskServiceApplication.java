package com.carsales.taskservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CarSalesTaskServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CarSalesTaskServiceApplication.class, args);
    }
}
