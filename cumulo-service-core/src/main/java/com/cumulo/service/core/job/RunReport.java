package com.cumulo.service.core.job;

import java.time.LocalDate;
import java.util.List;

/** Outcome of one daily run. Entities listed in {@code conflicts} kept their previous monthly arrays. */
public record RunReport(
        LocalDate asOfDate,
        int newEntities,
        int carriedForward,
        int extended,
        int recordsWritten,
        int arraysWritten,
        List<ArrayConflict> conflicts) {

    public RunReport {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public int entities() {
        return newEntities + carriedForward + extended;
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public record ArrayConflict(String entityKey, String metricName, String message) {}
}
