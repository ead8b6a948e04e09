package com.carsales.taskservice.task.dataset;

import com.carsales.taskservice.task.model.CarSaleRow;

import java.util.List;

public interface DatasetSource {

    /**
     * Reads the full raw row set. Called once per task; implementations must not cache.
     *
     * @throws DatasetUnavailableException when the source is missing or unreadable
     */
    List<CarSaleRow> load();

    String location();
}
