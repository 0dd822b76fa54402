package com.cumulo.service.storage.impl;

import com.cumulo.service.core.bitset.ActivityBitset;
import com.cumulo.service.core.model.ActivityHistory;
import com.cumulo.service.core.model.BitsetHistory;
import com.cumulo.service.core.model.DateListHistory;
import com.cumulo.service.core.model.HistoryFormat;
import com.fasterxml.jackson.core.type.TypeReference;
import java.time.LocalDate;
import java.util.List;

/** Column mapping for one dimension row of {@code cumulo.cumulative_activity}. */
final class ActivityHistoryCodec {

    private static final TypeReference<List<String>> DATE_LIST = new TypeReference<>() {};

    private ActivityHistoryCodec() {}

    record HistoryColumns(String format, String datesJson, Long bits, Integer width) {}

    static HistoryColumns encode(ActivityHistory history) {
        if (history instanceof DateListHistory dates) {
            List<String> iso = dates.dates().stream().map(LocalDate::toString).toList();
            return new HistoryColumns(HistoryFormat.DATE_LIST.name(), JsonUtil.toJson(iso), null, null);
        }
        if (history instanceof BitsetHistory bitset) {
            return new HistoryColumns(
                    HistoryFormat.BITSET.name(), null, bitset.bits().value(), bitset.bits().width());
        }
        throw new IllegalArgumentException("Unsupported history type: " + history.getClass().getName());
    }

    static ActivityHistory decode(HistoryColumns columns) {
        HistoryFormat format = HistoryFormat.valueOf(columns.format());
        return switch (format) {
            case DATE_LIST -> {
                List<String> iso = columns.datesJson() == null ? List.of() : JsonUtil.fromJson(columns.datesJson(), DATE_LIST);
                yield new DateListHistory(iso.stream().map(LocalDate::parse).toList());
            }
            case BITSET -> {
                if (columns.bits() == null || columns.width() == null) {
                    throw new IllegalStateException("Bitset history row is missing bits or width");
                }
                yield new BitsetHistory(ActivityBitset.of(columns.bits(), columns.width()));
            }
        };
    }
}
