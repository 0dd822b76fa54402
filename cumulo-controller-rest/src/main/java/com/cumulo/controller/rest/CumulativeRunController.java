package com.cumulo.controller.rest;

import com.cumulo.service.core.job.DailyCumulativeJob;
import com.cumulo.service.core.job.MonthlyArrayRewindService;
import com.cumulo.service.core.job.RunReport;
import java.time.LocalDate;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Manual triggers for backfill and replay of daily runs. */
@RestController
@RequestMapping(path = "/api/admin/runs", produces = MediaType.APPLICATION_JSON_VALUE)
@Slf4j
public class CumulativeRunController {

    private final DailyCumulativeJob job;
    private final MonthlyArrayRewindService rewindService;

    public CumulativeRunController(DailyCumulativeJob job, MonthlyArrayRewindService rewindService) {
        this.job = job;
        this.rewindService = rewindService;
    }

    @PostMapping("/{asOfDate}")
    public RunReport run(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOfDate) {
        log.info("Manual cumulative run requested asOfDate={}", asOfDate);
        return job.run(asOfDate);
    }

    /** Truncates monthly arrays so the run for {@code asOfDate} can be replayed. */
    @PostMapping("/{asOfDate}/rewind")
    public Map<String, Object> rewind(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOfDate) {
        int arrays = rewindService.rewind(asOfDate);
        return Map.of("fromDate", asOfDate.toString(), "arraysRewound", arrays);
    }
}
