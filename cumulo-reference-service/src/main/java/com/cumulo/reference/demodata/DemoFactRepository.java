package com.cumulo.reference.demodata;

import com.cumulo.service.core.model.DailyActivityFact;
import java.time.LocalDate;
import java.util.List;

interface DemoFactRepository {

    long countFacts(LocalDate activityDate);

    int insertFacts(List<DailyActivityFact> facts);
}
