package com.cumulo.service.core.reduced;

import com.cumulo.service.core.model.DailyActivityFact;
import java.util.Collection;
import java.util.Locale;

/** Daily values kept in monthly arrays, derived from one entity's facts for the day. */
public enum ReducedMetric {
    EVENT_COUNT("event_count"),
    ACTIVE_DIMENSIONS("active_dimensions");

    private final String metricName;

    ReducedMetric(String metricName) {
        this.metricName = metricName;
    }

    public String metricName() {
        return metricName;
    }

    public long extract(Collection<DailyActivityFact> facts) {
        if (facts == null || facts.isEmpty()) {
            return 0L;
        }
        return switch (this) {
            case EVENT_COUNT -> facts.stream().mapToLong(DailyActivityFact::eventCount).sum();
            case ACTIVE_DIMENSIONS -> facts.stream()
                    .map(DailyActivityFact::dimension)
                    .distinct()
                    .count();
        };
    }

    public static ReducedMetric fromConfigValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Reduced metric cannot be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (normalized) {
            case "EVENT_COUNT", "EVENTS", "HITS" -> EVENT_COUNT;
            case "ACTIVE_DIMENSIONS", "DIMENSIONS" -> ACTIVE_DIMENSIONS;
            default -> throw new IllegalArgumentException("Unsupported reduced metric: " + value);
        };
    }
}
