package com.cumulo.service.core.spi;

import com.cumulo.service.core.model.CumulativeRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CumulativeRecordStore {

    List<CumulativeRecord> findByAsOfDate(LocalDate asOfDate);

    Optional<CumulativeRecord> find(String entityKey, LocalDate asOfDate);

    /** Most recent as-of date strictly before {@code asOfDate} that holds any record. */
    Optional<LocalDate> latestAsOfDateBefore(LocalDate asOfDate);

    /**
     * Idempotent on (entityKey, asOfDate): each written record replaces whatever was stored for its key,
     * including dimensions the new record no longer has.
     *
     * @return number of records written
     */
    int upsertAll(List<CumulativeRecord> records);

    /** @return number of records removed */
    int deleteAsOfDate(LocalDate asOfDate);
}
