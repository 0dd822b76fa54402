package com.cumulo.service.storage.impl;

import com.cumulo.service.core.model.MonthlyMetricArray;
import com.cumulo.service.core.spi.MonthlyMetricArrayStore;
import com.fasterxml.jackson.core.type.TypeReference;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JdbcMonthlyMetricArrayStore implements MonthlyMetricArrayStore {

    private static final TypeReference<List<Long>> VALUES = new TypeReference<>() {};

    private static final String SELECT_COLUMNS =
            """
            select entity_key, month_start, metric_name, metric_values::text as metric_values, first_observed_day
              from cumulo.monthly_metric_arrays
            """;

    private static final String UPSERT_SQL =
            """
            insert into cumulo.monthly_metric_arrays
              (entity_key, month_start, metric_name, metric_values, first_observed_day, updated_at)
            values
              (:entity_key, :month_start, :metric_name, cast(:metric_values as jsonb), :first_observed_day, now())
            on conflict (entity_key, month_start, metric_name)
            do update set
              metric_values = excluded.metric_values,
              first_observed_day = excluded.first_observed_day,
              updated_at = now()
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<MonthlyMetricArray> findByMonth(YearMonth month, String metricName) {
        return jdbc.query(
                SELECT_COLUMNS + " where month_start = :month_start and metric_name = :metric_name order by entity_key",
                new MapSqlParameterSource()
                        .addValue("month_start", month.atDay(1))
                        .addValue("metric_name", metricName),
                JdbcMonthlyMetricArrayStore::mapRow);
    }

    @Override
    public Optional<MonthlyMetricArray> find(String entityKey, YearMonth month, String metricName) {
        List<MonthlyMetricArray> arrays = jdbc.query(
                SELECT_COLUMNS
                        + " where entity_key = :entity_key and month_start = :month_start"
                        + " and metric_name = :metric_name",
                params(entityKey, month, metricName),
                JdbcMonthlyMetricArrayStore::mapRow);
        return arrays.stream().findFirst();
    }

    @Override
    @Transactional
    public int upsertAll(List<MonthlyMetricArray> arrays) {
        if (arrays == null || arrays.isEmpty()) {
            return 0;
        }
        MapSqlParameterSource[] batch = arrays.stream()
                .map(array -> params(array.entityKey(), array.month(), array.metricName())
                        .addValue("metric_values", JsonUtil.toJson(array.values()))
                        .addValue("first_observed_day", array.firstObservedDay()))
                .toArray(MapSqlParameterSource[]::new);
        jdbc.batchUpdate(UPSERT_SQL, batch);
        return arrays.size();
    }

    @Override
    public boolean delete(String entityKey, YearMonth month, String metricName) {
        int removed = jdbc.update(
                """
                delete from cumulo.monthly_metric_arrays
                 where entity_key = :entity_key and month_start = :month_start and metric_name = :metric_name
                """,
                params(entityKey, month, metricName));
        return removed > 0;
    }

    private static MapSqlParameterSource params(String entityKey, YearMonth month, String metricName) {
        return new MapSqlParameterSource()
                .addValue("entity_key", entityKey)
                .addValue("month_start", month.atDay(1))
                .addValue("metric_name", metricName);
    }

    private static MonthlyMetricArray mapRow(ResultSet rs, int rowNum) throws SQLException {
        LocalDate monthStart = rs.getObject("month_start", LocalDate.class);
        return new MonthlyMetricArray(
                rs.getString("entity_key"),
                YearMonth.from(monthStart),
                rs.getString("metric_name"),
                JsonUtil.fromJson(rs.getString("metric_values"), VALUES),
                rs.getInt("first_observed_day"));
    }
}
