package com.cumulo.service.core.spi;

import com.cumulo.service.core.model.MonthlyMetricArray;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

public interface MonthlyMetricArrayStore {

    List<MonthlyMetricArray> findByMonth(YearMonth month, String metricName);

    Optional<MonthlyMetricArray> find(String entityKey, YearMonth month, String metricName);

    /**
     * Replaces the stored array for each (entityKey, month, metricName).
     *
     * @return number of arrays written
     */
    int upsertAll(List<MonthlyMetricArray> arrays);

    /** @return true if an array was removed */
    boolean delete(String entityKey, YearMonth month, String metricName);
}
