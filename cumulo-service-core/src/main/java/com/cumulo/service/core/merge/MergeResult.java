package com.cumulo.service.core.merge;

import com.cumulo.service.core.model.CumulativeRecord;

/** The record an entity gets for the run's as-of date, and which merge path produced it. */
public record MergeResult(MergeOutcome outcome, CumulativeRecord record) {

    public String entityKey() {
        return record.entityKey();
    }
}
