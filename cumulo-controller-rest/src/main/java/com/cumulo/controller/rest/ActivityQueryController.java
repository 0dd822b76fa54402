package com.cumulo.controller.rest;

import com.cumulo.service.core.query.ActivityQueryService;
import com.cumulo.service.core.window.WindowSummary;
import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/activity", produces = MediaType.APPLICATION_JSON_VALUE)
public class ActivityQueryController {

    private final ActivityQueryService queryService;

    public ActivityQueryController(ActivityQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/{entityKey}")
    public ResponseEntity<WindowSummary> summary(
            @PathVariable String entityKey,
            @RequestParam("asOf") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOfDate,
            @RequestParam(name = "dimension", required = false) String dimension) {
        return queryService
                .summarize(entityKey, asOfDate, dimension)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
