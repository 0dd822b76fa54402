package com.cumulo.controller.rest;

import com.cumulo.service.core.model.MonthlyMetricArray;
import com.cumulo.service.core.query.MonthlyMetricQueryService;
import com.cumulo.service.core.reduced.MonthlyRollup;
import java.time.YearMonth;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/metrics/monthly", produces = MediaType.APPLICATION_JSON_VALUE)
public class MonthlyMetricsController {

    private final MonthlyMetricQueryService queryService;

    public MonthlyMetricsController(MonthlyMetricQueryService queryService) {
        this.queryService = queryService;
    }

    /** {@code month} is {@code yyyy-MM}. */
    @GetMapping("/{metric}")
    public MonthlyRollup rollup(@PathVariable String metric, @RequestParam("month") String month) {
        return queryService.rollup(YearMonth.parse(month), metric);
    }

    @GetMapping("/{metric}/{entityKey}")
    public ResponseEntity<MonthlyMetricArray> entityArray(
            @PathVariable String metric, @PathVariable String entityKey, @RequestParam("month") String month) {
        return queryService
                .find(entityKey, YearMonth.parse(month), metric)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
