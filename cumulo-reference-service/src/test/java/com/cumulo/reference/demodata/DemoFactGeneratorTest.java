package com.cumulo.reference.demodata;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.cumulo.service.core.model.DailyActivityFact;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DemoFactGeneratorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 2, 12);

    @Test
    void disabledGeneratorWritesNothing() {
        FakeRepo repo = new FakeRepo();
        DemoFactGeneratorProperties props = baseProps();

        assertEquals(0, buildGenerator(repo, props).runOnce());
        assertEquals(0, repo.countFacts(TODAY));
    }

    @Test
    void seedsTodayOnceAndProducesValidFacts() {
        FakeRepo repo = new FakeRepo();
        DemoFactGeneratorProperties props = baseProps();
        props.setEnabled(true);
        props.setActiveRatio(1.0);
        props.setEntityCount(10);
        DemoFactGenerator generator = buildGenerator(repo, props);

        int inserted = generator.runOnce();
        assertTrue(inserted >= 10);
        assertEquals(inserted, repo.countFacts(TODAY));

        Set<String> seen = new HashSet<>();
        for (DailyActivityFact fact : repo.facts) {
            assertEquals(TODAY, fact.activityDate());
            assertTrue(fact.eventCount() >= 1 && fact.eventCount() <= props.getMaxEventsPerFact());
            assertTrue(seen.add(fact.entityKey() + "/" + fact.dimension()), "duplicate " + fact);
        }

        assertEquals(0, generator.runOnce());
        assertEquals(inserted, repo.countFacts(TODAY));
    }

    @Test
    void sameSeedGeneratesSameFacts() {
        DemoFactGeneratorProperties props = baseProps();
        props.setSeed(42L);
        DemoFactGenerator generator = buildGenerator(new FakeRepo(), props);
        SeededRandomProvider provider = new SeededRandomProvider(props);

        List<DailyActivityFact> first = generator.generate(TODAY, provider.forDay(TODAY));
        List<DailyActivityFact> second = generator.generate(TODAY, provider.forDay(TODAY));

        assertEquals(first, second);
    }

    @Test
    void noDimensionsConfiguredWritesUndimensionedFacts() {
        DemoFactGeneratorProperties props = baseProps();
        props.setDimensions(List.of());
        props.setActiveRatio(1.0);
        props.setEntityCount(3);

        List<DailyActivityFact> facts = buildGenerator(new FakeRepo(), props).generate(TODAY, new Random(7));

        assertEquals(3, facts.size());
        assertTrue(facts.stream().allMatch(f -> f.dimension().equals(DailyActivityFact.NO_DIMENSION)));
    }

    private static DemoFactGeneratorProperties baseProps() {
        DemoFactGeneratorProperties props = new DemoFactGeneratorProperties();
        props.setEntityCount(20);
        props.setMaxEventsPerFact(5);
        return props;
    }

    private static DemoFactGenerator buildGenerator(FakeRepo repo, DemoFactGeneratorProperties props) {
        Clock clock = Clock.fixed(Instant.parse("2026-02-12T12:00:00Z"), ZoneOffset.UTC);
        return new DemoFactGenerator(props, repo, day -> new Random(day.toEpochDay()), clock);
    }

    private static final class FakeRepo implements DemoFactRepository {
        private final List<DailyActivityFact> facts = new ArrayList<>();

        @Override
        public long countFacts(LocalDate activityDate) {
            return facts.stream().filter(f -> f.activityDate().equals(activityDate)).count();
        }

        @Override
        public int insertFacts(List<DailyActivityFact> newFacts) {
            facts.addAll(newFacts);
            return newFacts.size();
        }
    }
}
