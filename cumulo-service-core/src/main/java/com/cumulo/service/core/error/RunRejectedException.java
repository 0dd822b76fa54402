package com.cumulo.service.core.error;

import java.time.LocalDate;

/** Fatal problem with a run's input. Raised before anything is written for {@link #asOfDate()}. */
public abstract class RunRejectedException extends IllegalStateException {
    private final LocalDate asOfDate;

    protected RunRejectedException(LocalDate asOfDate, String message) {
        super(message);
        this.asOfDate = asOfDate;
    }

    public LocalDate asOfDate() {
        return asOfDate;
    }
}
