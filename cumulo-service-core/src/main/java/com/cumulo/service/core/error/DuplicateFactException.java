package com.cumulo.service.core.error;

import java.time.LocalDate;

public class DuplicateFactException extends RunRejectedException {
    private final String entityKey;
    private final String dimension;

    public DuplicateFactException(LocalDate asOfDate, String entityKey, String dimension) {
        super(
                asOfDate,
                "More than one fact for entity " + entityKey + " dimension '" + dimension + "' on " + asOfDate
                        + "; facts must be pre-aggregated");
        this.entityKey = entityKey;
        this.dimension = dimension;
    }

    public String entityKey() {
        return entityKey;
    }

    public String dimension() {
        return dimension;
    }
}
