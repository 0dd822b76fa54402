package com.cumulo.service.core.merge;

/** How an entity's record for the as-of date was derived. */
public enum MergeOutcome {
    /** No previous record; created from today's facts. */
    NEW,
    /** Previous record only; no activity today. */
    CARRIED_FORWARD,
    /** Previous record extended with today's facts. */
    EXTENDED
}
