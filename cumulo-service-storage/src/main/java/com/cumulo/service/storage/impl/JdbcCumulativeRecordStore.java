package com.cumulo.service.storage.impl;

import com.cumulo.service.core.model.ActivityHistory;
import com.cumulo.service.core.model.CumulativeRecord;
import com.cumulo.service.core.spi.CumulativeRecordStore;
import com.cumulo.service.storage.impl.ActivityHistoryCodec.HistoryColumns;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcCumulativeRecordStore implements CumulativeRecordStore {

    private static final String SELECT_COLUMNS =
            """
            select entity_key, as_of_date, dimension, history_format, dates_active::text as dates_active,
                   activity_bits, bit_width
              from cumulo.cumulative_activity
            """;

    private static final String UPSERT_SQL =
            """
            insert into cumulo.cumulative_activity
              (entity_key, as_of_date, dimension, history_format, dates_active, activity_bits, bit_width)
            values
              (:entity_key, :as_of_date, :dimension, :history_format, cast(:dates_active as jsonb),
               :activity_bits, :bit_width)
            on conflict (entity_key, as_of_date, dimension)
            do update set
              history_format = excluded.history_format,
              dates_active = excluded.dates_active,
              activity_bits = excluded.activity_bits,
              bit_width = excluded.bit_width
            """;

    // rows of dimensions the new record dropped must not survive the upsert
    private static final String CLEAR_RECORD_SQL =
            """
            delete from cumulo.cumulative_activity
             where entity_key = :entity_key and as_of_date = :as_of_date
            """;

    private final NamedParameterJdbcTemplate jdbc;

    @Override
    public List<CumulativeRecord> findByAsOfDate(LocalDate asOfDate) {
        List<Row> rows = jdbc.query(
                SELECT_COLUMNS + " where as_of_date = :as_of_date order by entity_key, dimension",
                new MapSqlParameterSource("as_of_date", asOfDate),
                JdbcCumulativeRecordStore::mapRow);
        return group(rows);
    }

    @Override
    public Optional<CumulativeRecord> find(String entityKey, LocalDate asOfDate) {
        List<Row> rows = jdbc.query(
                SELECT_COLUMNS + " where entity_key = :entity_key and as_of_date = :as_of_date order by dimension",
                new MapSqlParameterSource()
                        .addValue("entity_key", entityKey)
                        .addValue("as_of_date", asOfDate),
                JdbcCumulativeRecordStore::mapRow);
        List<CumulativeRecord> records = group(rows);
        return records.isEmpty() ? Optional.empty() : Optional.of(records.get(0));
    }

    @Override
    public Optional<LocalDate> latestAsOfDateBefore(LocalDate asOfDate) {
        LocalDate latest = jdbc.queryForObject(
                "select max(as_of_date) from cumulo.cumulative_activity where as_of_date < :as_of_date",
                new MapSqlParameterSource("as_of_date", asOfDate),
                LocalDate.class);
        return Optional.ofNullable(latest);
    }

    @Override
    @Transactional
    public int upsertAll(List<CumulativeRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        List<MapSqlParameterSource> keys = new ArrayList<>(records.size());
        List<MapSqlParameterSource> batch = new ArrayList<>();
        for (CumulativeRecord record : records) {
            keys.add(new MapSqlParameterSource()
                    .addValue("entity_key", record.entityKey())
                    .addValue("as_of_date", record.asOfDate()));
            record.activity().forEach((dimension, history) -> {
                HistoryColumns columns = ActivityHistoryCodec.encode(history);
                batch.add(new MapSqlParameterSource()
                        .addValue("entity_key", record.entityKey())
                        .addValue("as_of_date", record.asOfDate())
                        .addValue("dimension", dimension)
                        .addValue("history_format", columns.format())
                        .addValue("dates_active", columns.datesJson())
                        .addValue("activity_bits", columns.bits())
                        .addValue("bit_width", columns.width()));
            });
        }
        jdbc.batchUpdate(CLEAR_RECORD_SQL, keys.toArray(MapSqlParameterSource[]::new));
        jdbc.batchUpdate(UPSERT_SQL, batch.toArray(MapSqlParameterSource[]::new));
        log.debug("Upserted cumulative records={} rows={}", records.size(), batch.size());
        return records.size();
    }

    @Override
    @Transactional
    public int deleteAsOfDate(LocalDate asOfDate) {
        List<String> entities = jdbc.queryForList(
                "select distinct entity_key from cumulo.cumulative_activity where as_of_date = :as_of_date",
                new MapSqlParameterSource("as_of_date", asOfDate),
                String.class);
        if (entities.isEmpty()) {
            return 0;
        }
        int rows = jdbc.update(
                "delete from cumulo.cumulative_activity where as_of_date = :as_of_date",
                new MapSqlParameterSource("as_of_date", asOfDate));
        log.debug("Deleted cumulative records asOfDate={} records={} rows={}", asOfDate, entities.size(), rows);
        return entities.size();
    }

    private static Row mapRow(ResultSet rs, int rowNum) throws SQLException {
        long bits = rs.getLong("activity_bits");
        Long activityBits = rs.wasNull() ? null : bits;
        int width = rs.getInt("bit_width");
        Integer bitWidth = rs.wasNull() ? null : width;
        return new Row(
                rs.getString("entity_key"),
                rs.getObject("as_of_date", LocalDate.class),
                rs.getString("dimension"),
                new HistoryColumns(rs.getString("history_format"), rs.getString("dates_active"), activityBits, bitWidth));
    }

    static List<CumulativeRecord> group(List<Row> rows) {
        Map<String, List<Row>> byEntity = new LinkedHashMap<>();
        for (Row row : rows) {
            byEntity.computeIfAbsent(row.entityKey(), k -> new ArrayList<>()).add(row);
        }
        List<CumulativeRecord> records = new ArrayList<>(byEntity.size());
        byEntity.forEach((entityKey, entityRows) -> {
            TreeMap<String, ActivityHistory> activity = new TreeMap<>();
            for (Row row : entityRows) {
                activity.put(row.dimension(), ActivityHistoryCodec.decode(row.columns()));
            }
            records.add(new CumulativeRecord(entityKey, entityRows.get(0).asOfDate(), activity));
        });
        return records;
    }

    record Row(String entityKey, LocalDate asOfDate, String dimension, HistoryColumns columns) {}
}
