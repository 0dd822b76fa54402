package com.cumulo.reference.demodata;

import com.cumulo.service.core.model.DailyActivityFact;
import java.time.LocalDate;
import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
class JdbcDemoFactRepository implements DemoFactRepository {

    private final NamedParameterJdbcTemplate jdbc;

    JdbcDemoFactRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public long countFacts(LocalDate activityDate) {
        Long count = jdbc.queryForObject(
                "SELECT COUNT(*) FROM cumulo.daily_activity_facts WHERE activity_date = :activity_date",
                new MapSqlParameterSource("activity_date", activityDate),
                Long.class);
        return count == null ? 0L : count;
    }

    @Override
    public int insertFacts(List<DailyActivityFact> facts) {
        if (facts == null || facts.isEmpty()) {
            return 0;
        }
        String sql =
                """
                INSERT INTO cumulo.daily_activity_facts (entity_key, activity_date, dimension, event_count)
                VALUES (:entity_key, :activity_date, :dimension, :event_count)
                """;
        MapSqlParameterSource[] batch = facts.stream()
                .map(fact -> new MapSqlParameterSource()
                        .addValue("entity_key", fact.entityKey())
                        .addValue("activity_date", fact.activityDate())
                        .addValue("dimension", fact.dimension().isEmpty() ? null : fact.dimension())
                        .addValue("event_count", fact.eventCount()))
                .toArray(MapSqlParameterSource[]::new);
        int[] results = jdbc.batchUpdate(sql, batch);
        int inserted = 0;
        for (int result : results) {
            inserted += Math.max(result, 0);
        }
        return inserted;
    }
}
