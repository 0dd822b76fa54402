package com.cumulo.reference.demodata;

import com.cumulo.service.core.model.DailyActivityFact;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Seeds {@code daily_activity_facts} for the current day so a local instance has something to roll up. A day
 * that already has facts is left alone.
 */
@Component
@Slf4j
class DemoFactGenerator {

    private final DemoFactGeneratorProperties properties;
    private final DemoFactRepository repository;
    private final RandomProvider randomProvider;
    private final Clock clock;

    @Autowired
    DemoFactGenerator(
            DemoFactGeneratorProperties properties,
            DemoFactRepository repository,
            RandomProvider randomProvider,
            Clock clock) {
        this.properties = properties;
        this.repository = repository;
        this.randomProvider = randomProvider;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "#{@demoFactGeneratorProperties.runEvery.toMillis()}")
    public void scheduledRun() {
        runOnce();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startupRun() {
        runOnce();
    }

    int runOnce() {
        if (!properties.isEnabled()) {
            return 0;
        }
        LocalDate today = LocalDate.now(clock);
        if (repository.countFacts(today) > 0) {
            return 0;
        }
        List<DailyActivityFact> facts = generate(today, randomProvider.forDay(today));
        int inserted = repository.insertFacts(facts);
        log.info(
                "Demo fact generator run complete activityDate={} entities={} facts={}",
                today,
                facts.stream().map(DailyActivityFact::entityKey).distinct().count(),
                inserted);
        return inserted;
    }

    List<DailyActivityFact> generate(LocalDate day, Random random) {
        List<String> dimensions = properties.getDimensions().isEmpty()
                ? List.of(DailyActivityFact.NO_DIMENSION)
                : properties.getDimensions();
        List<DailyActivityFact> facts = new ArrayList<>();
        for (int i = 0; i < properties.getEntityCount(); i++) {
            if (random.nextDouble() >= properties.getActiveRatio()) {
                continue;
            }
            String entityKey = String.format("%s%04d", properties.getEntityPrefix(), i);
            int chosen = random.nextInt(dimensions.size());
            for (int d = 0; d < dimensions.size(); d++) {
                if (d == chosen || random.nextBoolean()) {
                    long events = 1L + random.nextInt(properties.getMaxEventsPerFact());
                    facts.add(new DailyActivityFact(entityKey, day, events, dimensions.get(d)));
                }
            }
        }
        return facts;
    }
}
