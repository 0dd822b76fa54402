package com.cumulo.service.core.error;

import java.time.LocalDate;

/**
 * The latest stored records are older than the day before the run. Merging anyway would treat every active
 * entity as new and drop its history, so the missing days have to be run first.
 */
public class PredecessorRunMissingException extends RunRejectedException {
    private final LocalDate latestAsOfDate;

    public PredecessorRunMissingException(LocalDate asOfDate, LocalDate latestAsOfDate) {
        super(
                asOfDate,
                "Run for " + asOfDate + " needs records as of " + asOfDate.minusDays(1) + " but the latest are as of "
                        + latestAsOfDate);
        this.latestAsOfDate = latestAsOfDate;
    }

    public LocalDate latestAsOfDate() {
        return latestAsOfDate;
    }
}
