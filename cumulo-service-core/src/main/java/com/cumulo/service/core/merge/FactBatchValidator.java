package com.cumulo.service.core.merge;

import com.cumulo.service.core.error.DuplicateFactException;
import com.cumulo.service.core.error.InvalidFactDateException;
import com.cumulo.service.core.model.DailyActivityFact;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/** Checks a run's facts at the ingestion boundary and indexes them by entity and dimension. */
public final class FactBatchValidator {

    private FactBatchValidator() {}

    /**
     * @return entity key to (dimension to fact), both sorted
     * @throws InvalidFactDateException if any fact is not dated {@code asOfDate}
     * @throws DuplicateFactException if an (entity, dimension) pair appears twice
     */
    public static SortedMap<String, SortedMap<String, DailyActivityFact>> groupByEntity(
            LocalDate asOfDate, Collection<DailyActivityFact> facts) {
        SortedMap<String, SortedMap<String, DailyActivityFact>> byEntity = new TreeMap<>();
        if (facts == null) {
            return byEntity;
        }
        for (DailyActivityFact fact : facts) {
            if (!asOfDate.equals(fact.activityDate())) {
                throw new InvalidFactDateException(asOfDate, fact.entityKey(), fact.activityDate());
            }
            Map<String, DailyActivityFact> byDimension =
                    byEntity.computeIfAbsent(fact.entityKey(), k -> new TreeMap<>());
            if (byDimension.putIfAbsent(fact.dimension(), fact) != null) {
                throw new DuplicateFactException(asOfDate, fact.entityKey(), fact.dimension());
            }
        }
        return byEntity;
    }
}
