package com.cumulo.service.core.spi;

import com.cumulo.service.core.model.DailyActivityFact;
import java.time.LocalDate;
import java.util.List;

/** Upstream aggregation output: one fact per (entity, dimension) for the requested day. */
public interface DailyActivityFactSource {

    List<DailyActivityFact> factsFor(LocalDate activityDate);
}
