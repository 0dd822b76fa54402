package com.cumulo.service.core.merge;

import com.cumulo.service.core.model.ActivityHistory;
import com.cumulo.service.core.model.CumulativeRecord;
import com.cumulo.service.core.model.DailyActivityFact;
import com.cumulo.service.core.model.HistoryFormat;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Derives an entity's record for day D from its record for D-1 and the facts of D. Stateless: the result depends
 * only on the arguments, so a run can be repeated for backfill.
 */
public class CumulativeMerger {

    private final HistoryFormat format;
    private final int bitsetWidth;

    public CumulativeMerger(HistoryFormat format, int bitsetWidth) {
        this.format = Objects.requireNonNull(format, "format");
        this.bitsetWidth = bitsetWidth;
    }

    public HistoryFormat format() {
        return format;
    }

    public int bitsetWidth() {
        return bitsetWidth;
    }

    /**
     * @param previous the entity's record for {@code asOfDate - 1}, or {@code null} for a first-seen entity
     * @param facts the entity's facts dated {@code asOfDate}, at most one per dimension
     */
    public MergeResult merge(CumulativeRecord previous, Collection<DailyActivityFact> facts, LocalDate asOfDate) {
        Objects.requireNonNull(asOfDate, "asOfDate");
        SortedMap<String, SortedMap<String, DailyActivityFact>> grouped =
                FactBatchValidator.groupByEntity(asOfDate, facts);
        if (grouped.size() > 1) {
            throw new IllegalArgumentException("Facts span several entities: " + grouped.keySet());
        }
        if (previous == null && grouped.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge for " + asOfDate);
        }
        String entityKey = previous != null ? previous.entityKey() : grouped.firstKey();
        SortedMap<String, DailyActivityFact> today = grouped.getOrDefault(entityKey, new TreeMap<>());
        if (!grouped.isEmpty() && !grouped.containsKey(entityKey)) {
            throw new IllegalArgumentException(
                    "Facts for " + grouped.firstKey() + " cannot extend the record of " + entityKey);
        }
        return mergeEntity(entityKey, previous, today, asOfDate);
    }

    /**
     * Full outer join of yesterday's records with today's facts: one result per entity found on either side,
     * ordered by entity key.
     */
    public List<MergeResult> mergeAll(
            Collection<CumulativeRecord> previous, Collection<DailyActivityFact> facts, LocalDate asOfDate) {
        Objects.requireNonNull(asOfDate, "asOfDate");
        SortedMap<String, SortedMap<String, DailyActivityFact>> factsByEntity =
                FactBatchValidator.groupByEntity(asOfDate, facts);
        Map<String, CumulativeRecord> previousByEntity = indexByEntity(previous);

        TreeSet<String> entities = new TreeSet<>(previousByEntity.keySet());
        entities.addAll(factsByEntity.keySet());
        List<MergeResult> results = new ArrayList<>(entities.size());
        for (String entityKey : entities) {
            results.add(mergeEntity(
                    entityKey,
                    previousByEntity.get(entityKey),
                    factsByEntity.getOrDefault(entityKey, new TreeMap<>()),
                    asOfDate));
        }
        return results;
    }

    /** Merge of already validated input; {@code today} maps dimension to that dimension's fact. */
    MergeResult mergeEntity(
            String entityKey, CumulativeRecord previous, Map<String, DailyActivityFact> today, LocalDate asOfDate) {
        if (previous == null) {
            SortedMap<String, ActivityHistory> activity = new TreeMap<>();
            for (String dimension : today.keySet()) {
                activity.put(dimension, ActivityHistory.firstSeen(format, asOfDate, bitsetWidth));
            }
            return new MergeResult(MergeOutcome.NEW, new CumulativeRecord(entityKey, asOfDate, activity));
        }
        checkPredecessor(previous, asOfDate);

        SortedMap<String, ActivityHistory> activity = new TreeMap<>();
        previous.activity().forEach((dimension, history) -> activity.put(
                dimension, today.containsKey(dimension) ? history.extend(asOfDate) : history.carryForward(asOfDate)));
        for (String dimension : today.keySet()) {
            activity.computeIfAbsent(dimension, d -> ActivityHistory.firstSeen(format, asOfDate, bitsetWidth));
        }
        MergeOutcome outcome = today.isEmpty() ? MergeOutcome.CARRIED_FORWARD : MergeOutcome.EXTENDED;
        return new MergeResult(outcome, new CumulativeRecord(entityKey, asOfDate, activity));
    }

    private static void checkPredecessor(CumulativeRecord previous, LocalDate asOfDate) {
        LocalDate expected = asOfDate.minusDays(1);
        if (!expected.equals(previous.asOfDate())) {
            throw new IllegalArgumentException("Record for " + previous.entityKey() + " is as of "
                    + previous.asOfDate() + " but the run for " + asOfDate + " needs " + expected);
        }
    }

    private static Map<String, CumulativeRecord> indexByEntity(Collection<CumulativeRecord> records) {
        Map<String, CumulativeRecord> byEntity = new TreeMap<>();
        if (records == null) {
            return byEntity;
        }
        for (CumulativeRecord record : records) {
            if (byEntity.putIfAbsent(record.entityKey(), record) != null) {
                throw new IllegalArgumentException(
                        "Several records for " + record.entityKey() + " as of " + record.asOfDate());
            }
        }
        return byEntity;
    }
}
