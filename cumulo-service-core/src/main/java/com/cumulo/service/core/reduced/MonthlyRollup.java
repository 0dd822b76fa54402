package com.cumulo.service.core.reduced;

import com.cumulo.service.core.model.MonthlyMetricArray;
import java.time.YearMonth;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/** Cross-entity totals over aligned monthly arrays. */
public record MonthlyRollup(YearMonth month, String metricName, int entities, List<Long> dailyTotals, long total) {

    public MonthlyRollup {
        dailyTotals = List.copyOf(dailyTotals);
    }

    /** Sums position by position; arrays must all belong to {@code month} and {@code metricName}. */
    public static MonthlyRollup sumByDay(YearMonth month, String metricName, Collection<MonthlyMetricArray> arrays) {
        int days = 0;
        for (MonthlyMetricArray array : arrays) {
            if (!array.month().equals(month) || !array.metricName().equals(metricName)) {
                throw new IllegalArgumentException("Array " + array.metricName() + "/" + array.month()
                        + " does not belong to rollup " + metricName + "/" + month);
            }
            days = Math.max(days, array.length());
        }
        long[] sums = new long[days];
        for (MonthlyMetricArray array : arrays) {
            List<Long> values = array.values();
            for (int i = 0; i < values.size(); i++) {
                sums[i] += values.get(i);
            }
        }
        List<Long> dailyTotals = Arrays.stream(sums).boxed().toList();
        long total = Arrays.stream(sums).sum();
        return new MonthlyRollup(month, metricName, arrays.size(), dailyTotals, total);
    }
}
