package com.cumulo.service.core.job;

import com.cumulo.service.core.config.CumuloProperties;
import com.cumulo.service.core.model.MonthlyMetricArray;
import com.cumulo.service.core.reduced.ReducedMetric;
import com.cumulo.service.core.spi.MonthlyMetricArrayStore;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Truncates every monthly array of a month back to the day before {@code fromDate}, so the run for
 * {@code fromDate} can be replayed without a replay conflict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlyArrayRewindService {

    private final MonthlyMetricArrayStore arrayStore;
    private final CumuloProperties properties;
    private final TransactionOperations txOperations;

    public int rewind(LocalDate fromDate) {
        YearMonth month = YearMonth.from(fromDate);
        int day = fromDate.getDayOfMonth();
        List<MonthlyMetricArray> truncated = new ArrayList<>();
        List<MonthlyMetricArray> emptied = new ArrayList<>();
        for (ReducedMetric metric : properties.getReduced().resolvedMetrics()) {
            for (MonthlyMetricArray array : arrayStore.findByMonth(month, metric.metricName())) {
                if (array.length() < day) {
                    continue;
                }
                Optional<MonthlyMetricArray> kept = array.truncateTo(day);
                if (kept.isPresent()) {
                    truncated.add(kept.get());
                } else {
                    emptied.add(array);
                }
            }
        }
        txOperations.executeWithoutResult(status -> {
            arrayStore.upsertAll(truncated);
            emptied.forEach(a -> arrayStore.delete(a.entityKey(), a.month(), a.metricName()));
        });
        log.info(
                "Rewound monthly arrays fromDate={} truncated={} removed={}", fromDate, truncated.size(), emptied.size());
        return truncated.size() + emptied.size();
    }
}
