package com.cumulo.service.core.query;

import com.cumulo.service.core.model.CumulativeRecord;
import com.cumulo.service.core.spi.CumulativeRecordStore;
import com.cumulo.service.core.window.WindowMetrics;
import com.cumulo.service.core.window.WindowSummary;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ActivityQueryService {

    private final CumulativeRecordStore recordStore;
    private final WindowMetrics windowMetrics;

    public Optional<CumulativeRecord> find(String entityKey, LocalDate asOfDate) {
        if (entityKey == null || entityKey.isBlank()) {
            throw new IllegalArgumentException("entityKey is required");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("asOfDate is required");
        }
        return recordStore.find(entityKey, asOfDate);
    }

    /** Summary for one dimension, or across all dimensions when {@code dimension} is null. */
    public Optional<WindowSummary> summarize(String entityKey, LocalDate asOfDate, String dimension) {
        return find(entityKey, asOfDate).flatMap(record -> windowMetrics.summarize(record, dimension));
    }
}
