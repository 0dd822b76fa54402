package com.cumulo.service.core.query;

import com.cumulo.service.core.model.MonthlyMetricArray;
import com.cumulo.service.core.reduced.MonthlyRollup;
import com.cumulo.service.core.reduced.ReducedMetric;
import com.cumulo.service.core.spi.MonthlyMetricArrayStore;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
@Slf4j
public class MonthlyMetricQueryService {

    private final MonthlyMetricArrayStore arrayStore;

    public MonthlyRollup rollup(YearMonth month, String metric) {
        String metricName = resolve(month, metric);
        List<MonthlyMetricArray> arrays = arrayStore.findByMonth(month, metricName);
        MonthlyRollup rollup = MonthlyRollup.sumByDay(month, metricName, arrays);
        if (log.isDebugEnabled()) {
            log.debug(
                    "Monthly rollup month={} metric={} entities={} days={}",
                    month,
                    metricName,
                    rollup.entities(),
                    rollup.dailyTotals().size());
        }
        return rollup;
    }

    public Optional<MonthlyMetricArray> find(String entityKey, YearMonth month, String metric) {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("entityKey is required");
        }
        return arrayStore.find(entityKey, month, resolve(month, metric));
    }

    private static String resolve(YearMonth month, String metric) {
        if (month == null) {
            throw new IllegalArgumentException("month is required");
        }
        return ReducedMetric.fromConfigValue(metric).metricName();
    }
}
