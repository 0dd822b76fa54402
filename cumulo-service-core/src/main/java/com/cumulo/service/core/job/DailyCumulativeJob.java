package com.cumulo.service.core.job;

import com.cumulo.service.core.config.CumuloProperties;
import com.cumulo.service.core.error.PredecessorRunMissingException;
import com.cumulo.service.core.error.ReplayConflictException;
import com.cumulo.service.core.merge.CumulativeMerger;
import com.cumulo.service.core.merge.FactBatchValidator;
import com.cumulo.service.core.merge.MergeOutcome;
import com.cumulo.service.core.merge.MergeResult;
import com.cumulo.service.core.model.CumulativeRecord;
import com.cumulo.service.core.model.DailyActivityFact;
import com.cumulo.service.core.model.MonthlyMetricArray;
import com.cumulo.service.core.reduced.ReducedArrayAccumulator;
import com.cumulo.service.core.reduced.ReducedMetric;
import com.cumulo.service.core.spi.CumulativeRecordStore;
import com.cumulo.service.core.spi.DailyActivityFactSource;
import com.cumulo.service.core.spi.MonthlyMetricArrayStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

/**
 * Daily batch: merges the records of D-1 with the facts of D, then appends day D to the monthly arrays. Input
 * errors and a missing D-1 run abort the run before anything is written; replay conflicts on monthly arrays only
 * skip the entity. Re-running D replaces every record stored for D.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DailyCumulativeJob {

    private final DailyActivityFactSource factSource;
    private final CumulativeRecordStore recordStore;
    private final MonthlyMetricArrayStore arrayStore;
    private final CumulativeMerger merger;
    private final ReducedArrayAccumulator accumulator;
    private final CumuloProperties properties;
    private final TransactionOperations txOperations;
    private final Clock clock;

    private int workers;
    private ExecutorService executor;

    @PostConstruct
    void start() {
        init(properties.getJob().getWorkers());
    }

    void init(int workerCount) {
        this.workers = Math.max(1, workerCount);
        this.executor = Executors.newFixedThreadPool(workers);
        log.info("Daily cumulative job started workers={}", workers);
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Scheduled(cron = "${cumulo.job.cron:0 30 0 * * *}", zone = "${cumulo.job.zone:UTC}")
    public void runScheduled() {
        if (!properties.getJob().isEnabled()) {
            return;
        }
        LocalDate asOfDate = LocalDate.now(clock).minusDays(1);
        try {
            run(asOfDate);
        } catch (Exception ex) {
            log.error("Daily cumulative run failed asOfDate={}", asOfDate, ex);
        }
    }

    public RunReport run(LocalDate asOfDate) {
        long started = System.nanoTime();
        checkPredecessorRun(asOfDate);
        List<DailyActivityFact> facts = factSource.factsFor(asOfDate);
        SortedMap<String, SortedMap<String, DailyActivityFact>> factsByEntity =
                FactBatchValidator.groupByEntity(asOfDate, facts);
        Map<String, CumulativeRecord> previous = indexPrevious(recordStore.findByAsOfDate(asOfDate.minusDays(1)));
        log.info(
                "Cumulative run asOfDate={} facts={} activeEntities={} previousRecords={}",
                asOfDate,
                facts.size(),
                factsByEntity.size(),
                previous.size());

        List<MergeResult> merged = mergeSharded(asOfDate, previous, factsByEntity);
        List<CumulativeRecord> records =
                merged.stream().map(MergeResult::record).toList();

        List<MonthlyMetricArray> arrays = new ArrayList<>();
        List<RunReport.ArrayConflict> conflicts = new ArrayList<>();
        for (ReducedMetric metric : properties.getReduced().resolvedMetrics()) {
            appendMetric(asOfDate, metric, factsByEntity, arrays, conflicts);
        }

        int[] written = new int[2];
        txOperations.executeWithoutResult(status -> {
            int replaced = recordStore.deleteAsOfDate(asOfDate);
            if (replaced > 0) {
                log.info("Replacing cumulative records asOfDate={} previouslyStored={}", asOfDate, replaced);
            }
            written[0] = recordStore.upsertAll(records);
            written[1] = arrayStore.upsertAll(arrays);
        });

        EnumMap<MergeOutcome, Integer> outcomes = new EnumMap<>(MergeOutcome.class);
        for (MergeResult result : merged) {
            outcomes.merge(result.outcome(), 1, Integer::sum);
        }
        RunReport report = new RunReport(
                asOfDate,
                outcomes.getOrDefault(MergeOutcome.NEW, 0),
                outcomes.getOrDefault(MergeOutcome.CARRIED_FORWARD, 0),
                outcomes.getOrDefault(MergeOutcome.EXTENDED, 0),
                written[0],
                written[1],
                conflicts);
        log.info(
                "Cumulative run complete asOfDate={} new={} carried={} extended={} arrays={} conflicts={} tookMs={}",
                asOfDate,
                report.newEntities(),
                report.carriedForward(),
                report.extended(),
                report.arraysWritten(),
                report.conflicts().size(),
                (System.nanoTime() - started) / 1_000_000);
        return report;
    }

    /** Records for D-1 must exist unless nothing was ever stored before D. */
    private void checkPredecessorRun(LocalDate asOfDate) {
        Optional<LocalDate> latest = recordStore.latestAsOfDateBefore(asOfDate);
        if (latest.isPresent() && !latest.get().equals(asOfDate.minusDays(1))) {
            throw new PredecessorRunMissingException(asOfDate, latest.get());
        }
    }

    private List<MergeResult> mergeSharded(
            LocalDate asOfDate,
            Map<String, CumulativeRecord> previous,
            SortedMap<String, SortedMap<String, DailyActivityFact>> factsByEntity) {
        TreeSet<String> entities = new TreeSet<>(previous.keySet());
        entities.addAll(factsByEntity.keySet());

        List<List<String>> shards = new ArrayList<>(workers);
        for (int i = 0; i < workers; i++) {
            shards.add(new ArrayList<>());
        }
        for (String entityKey : entities) {
            shards.get(Math.floorMod(entityKey.hashCode(), workers)).add(entityKey);
        }

        List<Future<List<MergeResult>>> futures = new ArrayList<>(workers);
        for (List<String> shard : shards) {
            if (shard.isEmpty()) {
                continue;
            }
            futures.add(executor.submit(() -> {
                List<MergeResult> results = new ArrayList<>(shard.size());
                for (String entityKey : shard) {
                    Collection<DailyActivityFact> today =
                            factsByEntity.getOrDefault(entityKey, new TreeMap<>()).values();
                    results.add(merger.merge(previous.get(entityKey), today, asOfDate));
                }
                return results;
            }));
        }

        List<MergeResult> merged = new ArrayList<>(entities.size());
        for (Future<List<MergeResult>> future : futures) {
            merged.addAll(await(future, asOfDate));
        }
        merged.sort((a, b) -> a.entityKey().compareTo(b.entityKey()));
        return merged;
    }

    private void appendMetric(
            LocalDate asOfDate,
            ReducedMetric metric,
            SortedMap<String, SortedMap<String, DailyActivityFact>> factsByEntity,
            List<MonthlyMetricArray> out,
            List<RunReport.ArrayConflict> conflicts) {
        YearMonth month = YearMonth.from(asOfDate);
        int day = asOfDate.getDayOfMonth();
        Map<String, MonthlyMetricArray> existing = new TreeMap<>();
        for (MonthlyMetricArray array : arrayStore.findByMonth(month, metric.metricName())) {
            existing.put(array.entityKey(), array);
        }
        TreeSet<String> entities = new TreeSet<>(existing.keySet());
        entities.addAll(factsByEntity.keySet());
        for (String entityKey : entities) {
            SortedMap<String, DailyActivityFact> today = factsByEntity.get(entityKey);
            MonthlyMetricArray current = existing.get(entityKey);
            try {
                out.add(
                        today == null
                                ? accumulator.appendInactive(current, day, month)
                                : accumulator.appendDay(
                                        current,
                                        entityKey,
                                        metric.metricName(),
                                        day,
                                        metric.extract(today.values()),
                                        month));
            } catch (ReplayConflictException ex) {
                log.warn(
                        "Skipping monthly array metric={} entity={} asOfDate={}: {}",
                        metric.metricName(),
                        entityKey,
                        asOfDate,
                        ex.getMessage());
                conflicts.add(new RunReport.ArrayConflict(entityKey, metric.metricName(), ex.getMessage()));
            }
        }
    }

    private static Map<String, CumulativeRecord> indexPrevious(List<CumulativeRecord> records) {
        Map<String, CumulativeRecord> byEntity = new TreeMap<>();
        for (CumulativeRecord record : records) {
            if (byEntity.putIfAbsent(record.entityKey(), record) != null) {
                throw new IllegalStateException(
                        "Several records for " + record.entityKey() + " as of " + record.asOfDate());
            }
        }
        return byEntity;
    }

    private static List<MergeResult> await(Future<List<MergeResult>> future, LocalDate asOfDate) {
        try {
            return future.get();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while merging run " + asOfDate, ie);
        } catch (ExecutionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Merge failed for run " + asOfDate, ex.getCause());
        }
    }
}
