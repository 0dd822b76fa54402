package com.cumulo.service.core.window;

import java.time.LocalDate;

/**
 * Point-in-time rollup of one entity's activity. {@code dimension} is {@code null} when the summary covers all
 * dimensions.
 */
public record WindowSummary(
        String entityKey,
        LocalDate asOfDate,
        String dimension,
        boolean monthlyActive,
        boolean weeklyActive,
        boolean weeklyActivePreviousWeek,
        int daysActiveLastWeek,
        int daysActiveLastMonth,
        long datelistInt,
        String datelistBits) {}
