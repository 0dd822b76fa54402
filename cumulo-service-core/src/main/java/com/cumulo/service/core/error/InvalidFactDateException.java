package com.cumulo.service.core.error;

import java.time.LocalDate;

public class InvalidFactDateException extends RunRejectedException {
    private final String entityKey;
    private final LocalDate factDate;

    public InvalidFactDateException(LocalDate asOfDate, String entityKey, LocalDate factDate) {
        super(asOfDate, "Fact for entity " + entityKey + " is dated " + factDate + " in the run for " + asOfDate);
        this.entityKey = entityKey;
        this.factDate = factDate;
    }

    public String entityKey() {
        return entityKey;
    }

    public LocalDate factDate() {
        return factDate;
    }
}
