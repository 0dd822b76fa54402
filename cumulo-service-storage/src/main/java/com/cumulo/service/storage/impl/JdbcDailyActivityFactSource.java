package com.cumulo.service.storage.impl;

import com.cumulo.service.core.model.DailyActivityFact;
import com.cumulo.service.core.spi.DailyActivityFactSource;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Reads the upstream {@code daily_activity_facts} table, collapsing repeated (entity, dimension) rows and dropping
 * rows without an entity key.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcDailyActivityFactSource implements DailyActivityFactSource {

    private static final String FACTS_SQL =
            """
            select entity_key, activity_date, coalesce(dimension, '') as dimension, sum(event_count) as event_count
              from cumulo.daily_activity_facts
             where activity_date = :activity_date
               and entity_key is not null
             group by entity_key, activity_date, coalesce(dimension, '')
            having sum(event_count) > 0
             order by entity_key, dimension
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<DailyActivityFact> factsFor(LocalDate activityDate) {
        List<DailyActivityFact> facts = jdbc.query(
                FACTS_SQL,
                new MapSqlParameterSource("activity_date", activityDate),
                (rs, rowNum) -> new DailyActivityFact(
                        rs.getString("entity_key"),
                        rs.getObject("activity_date", LocalDate.class),
                        rs.getLong("event_count"),
                        rs.getString("dimension")));
        log.info("Loaded daily activity facts activityDate={} facts={}", activityDate, facts.size());
        return facts;
    }
}
