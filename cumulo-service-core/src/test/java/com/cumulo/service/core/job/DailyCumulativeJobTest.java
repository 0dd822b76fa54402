package com.cumulo.service.core.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import com.cumulo.service.core.config.CumuloProperties;
import com.cumulo.service.core.error.InvalidFactDateException;
import com.cumulo.service.core.error.PredecessorRunMissingException;
import com.cumulo.service.core.merge.CumulativeMerger;
import com.cumulo.service.core.model.CumulativeRecord;
import com.cumulo.service.core.model.DailyActivityFact;
import com.cumulo.service.core.model.DateListHistory;
import com.cumulo.service.core.model.HistoryFormat;
import com.cumulo.service.core.model.MonthlyMetricArray;
import com.cumulo.service.core.reduced.ReducedArrayAccumulator;
import com.cumulo.service.core.spi.DailyActivityFactSource;
import com.cumulo.service.core.support.InMemoryCumulativeRecordStore;
import com.cumulo.service.core.support.InMemoryMonthlyMetricArrayStore;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionOperations;

class DailyCumulativeJobTest {

    private static final LocalDate MAR_30 = LocalDate.parse("2023-03-30");
    private static final LocalDate MAR_31 = LocalDate.parse("2023-03-31");
    private static final YearMonth MARCH = YearMonth.of(2023, 3);

    private final List<DailyActivityFact> facts = new ArrayList<>();
    private InMemoryCumulativeRecordStore recordStore;
    private InMemoryMonthlyMetricArrayStore arrayStore;
    private CumuloProperties properties;
    private DailyCumulativeJob job;

    @BeforeEach
    void setup() {
        recordStore = new InMemoryCumulativeRecordStore();
        arrayStore = new InMemoryMonthlyMetricArrayStore();
        properties = new CumuloProperties();
        properties.getReduced().setMetrics(List.of("event_count"));
        Clock clock = Clock.fixed(Instant.parse("2023-04-01T00:30:00Z"), ZoneOffset.UTC);
        job = buildJob(date -> List.copyOf(facts), clock);

        recordStore.put(CumulativeRecord.single(
                "u1",
                MAR_30,
                DateListHistory.of(
                        LocalDate.parse("2023-03-01"), LocalDate.parse("2023-03-15"), LocalDate.parse("2023-03-29"))));
        recordStore.put(CumulativeRecord.single("u2", MAR_30, DateListHistory.of(LocalDate.parse("2023-03-10"))));
        arrayStore.put(new MonthlyMetricArray("u1", MARCH, "event_count", Collections.nCopies(30, 1L), 1));
        arrayStore.put(new MonthlyMetricArray("u2", MARCH, "event_count", Collections.nCopies(30, 0L), 10));

        facts.add(new DailyActivityFact("u1", MAR_31, 5));
        facts.add(new DailyActivityFact("u3", MAR_31, 2, "chrome"));
        facts.add(new DailyActivityFact("u3", MAR_31, 1, "firefox"));
    }

    @AfterEach
    void tearDown() {
        job.stop();
    }

    @Test
    void runMergesEveryEntityAndAppendsMonthlyArrays() {
        RunReport report = job.run(MAR_31);

        assertEquals(1, report.newEntities());
        assertEquals(1, report.carriedForward());
        assertEquals(1, report.extended());
        assertEquals(3, report.recordsWritten());
        assertEquals(3, report.arraysWritten());
        assertThat(report.hasConflicts()).isFalse();

        assertThat(dates("u1", "")).containsExactly(
                LocalDate.parse("2023-03-01"), LocalDate.parse("2023-03-15"), LocalDate.parse("2023-03-29"), MAR_31);
        assertThat(dates("u2", "")).containsExactly(LocalDate.parse("2023-03-10"));
        assertThat(dates("u3", "chrome")).containsExactly(MAR_31);
        assertThat(dates("u3", "firefox")).containsExactly(MAR_31);

        MonthlyMetricArray u1 = array("u1");
        MonthlyMetricArray u2 = array("u2");
        MonthlyMetricArray u3 = array("u3");
        assertEquals(31, u1.length());
        assertEquals(5L, u1.valueOn(31));
        assertEquals(0L, u2.valueOn(31));
        assertEquals(3L, u3.valueOn(31));
        assertEquals(31, u3.firstObservedDay());
        assertEquals(0L, u3.total() - u3.valueOn(31));
    }

    @Test
    void rerunKeepsRecordsAndReportsArrayConflicts() {
        job.run(MAR_31);
        List<CumulativeRecord> firstPass = recordStore.findByAsOfDate(MAR_31);

        RunReport rerun = job.run(MAR_31);

        assertThat(recordStore.findByAsOfDate(MAR_31)).isEqualTo(firstPass);
        assertEquals(0, rerun.arraysWritten());
        assertThat(rerun.conflicts())
                .extracting(RunReport.ArrayConflict::entityKey)
                .containsExactly("u1", "u2", "u3");
        assertEquals(5L, array("u1").valueOn(31));
    }

    @Test
    void rewindAllowsMonthlyReplay() {
        job.run(MAR_31);
        MonthlyArrayRewindService rewind =
                new MonthlyArrayRewindService(arrayStore, properties, TransactionOperations.withoutTransaction());

        assertEquals(3, rewind.rewind(MAR_31));
        assertEquals(30, array("u1").length());
        assertThat(arrayStore.find("u3", MARCH, "event_count")).isEmpty();

        RunReport replay = job.run(MAR_31);

        assertThat(replay.hasConflicts()).isFalse();
        assertEquals(5L, array("u1").valueOn(31));
        assertEquals(3L, array("u3").valueOn(31));
    }

    @Test
    void factsForAnotherDayAbortBeforeWriting() {
        facts.add(new DailyActivityFact("u4", MAR_30, 1));

        assertThrows(InvalidFactDateException.class, () -> job.run(MAR_31));
        assertEquals(0, recordStore.upsertCalls());
        assertEquals(30, array("u1").length());
    }

    @Test
    void missedDayRejectsRunAndKeepsHistory() {
        LocalDate apr1 = LocalDate.parse("2023-04-01");
        facts.clear();
        facts.add(new DailyActivityFact("u1", apr1, 4));

        PredecessorRunMissingException ex =
                assertThrows(PredecessorRunMissingException.class, () -> job.run(apr1));

        assertEquals(MAR_30, ex.latestAsOfDate());
        assertEquals(apr1, ex.asOfDate());
        assertEquals(0, recordStore.upsertCalls());
        assertThat(recordStore.findByAsOfDate(apr1)).isEmpty();
        assertThat(recordStore.find("u1", MAR_31)).isEmpty();
        assertThat(recordStore.find("u1", MAR_30).orElseThrow().history("").orElseThrow())
                .isEqualTo(DateListHistory.of(
                        LocalDate.parse("2023-03-01"), LocalDate.parse("2023-03-15"), LocalDate.parse("2023-03-29")));
        assertEquals(30, array("u1").length());
    }

    @Test
    void firstRunOnEmptyStoreTreatsEveryoneAsNew() {
        recordStore = new InMemoryCumulativeRecordStore();
        job.stop();
        job = buildJob(date -> List.copyOf(facts), Clock.systemUTC());

        RunReport report = job.run(MAR_31);

        assertEquals(2, report.newEntities());
        assertThat(recordStore.findByAsOfDate(MAR_31)).extracting(CumulativeRecord::entityKey)
                .containsExactly("u1", "u3");
    }

    @Test
    void rerunReplacesRecordsOfTheDay() {
        job.run(MAR_31);
        facts.removeIf(f -> f.entityKey().equals("u3") && f.dimension().equals("firefox"));
        recordStore.put(CumulativeRecord.single("stale", MAR_31, DateListHistory.of(MAR_31)));

        job.run(MAR_31);

        assertThat(recordStore.findByAsOfDate(MAR_31)).extracting(CumulativeRecord::entityKey)
                .containsExactly("u1", "u2", "u3");
        assertThat(recordStore.find("u3", MAR_31).orElseThrow().activity()).containsOnlyKeys("chrome");
    }

    @Test
    void duplicatePreviousRecordsAbortTheRun() {
        InMemoryCumulativeRecordStore duplicated = new InMemoryCumulativeRecordStore() {
            @Override
            public List<CumulativeRecord> findByAsOfDate(LocalDate asOfDate) {
                CumulativeRecord r = CumulativeRecord.single("u1", MAR_30, DateListHistory.of(MAR_30));
                return List.of(r, r);
            }
        };
        job.stop();
        job = new DailyCumulativeJob(
                date -> List.of(),
                duplicated,
                arrayStore,
                new CumulativeMerger(HistoryFormat.DATE_LIST, 32),
                new ReducedArrayAccumulator(),
                properties,
                TransactionOperations.withoutTransaction(),
                Clock.systemUTC());
        job.init(1);

        assertThrows(IllegalStateException.class, () -> job.run(MAR_31));
    }

    @Test
    void scheduledRunProcessesYesterday() {
        job.runScheduled();

        assertThat(recordStore.findByAsOfDate(MAR_31)).hasSize(3);
    }

    @Test
    void scheduledRunSkipsWhenDisabled() {
        DailyActivityFactSource source = mock(DailyActivityFactSource.class);
        job.stop();
        job = buildJob(source, Clock.systemUTC());
        properties.getJob().setEnabled(false);

        job.runScheduled();

        verifyNoInteractions(source);
    }

    private DailyCumulativeJob buildJob(DailyActivityFactSource source, Clock clock) {
        DailyCumulativeJob built = new DailyCumulativeJob(
                source,
                recordStore,
                arrayStore,
                new CumulativeMerger(HistoryFormat.DATE_LIST, 32),
                new ReducedArrayAccumulator(),
                properties,
                TransactionOperations.withoutTransaction(),
                clock);
        built.init(2);
        return built;
    }

    private List<LocalDate> dates(String entityKey, String dimension) {
        CumulativeRecord record = recordStore.find(entityKey, MAR_31).orElseThrow();
        return ((DateListHistory) record.history(dimension).orElseThrow()).dates();
    }

    private MonthlyMetricArray array(String entityKey) {
        return arrayStore.find(entityKey, MARCH, "event_count").orElseThrow();
    }
}
