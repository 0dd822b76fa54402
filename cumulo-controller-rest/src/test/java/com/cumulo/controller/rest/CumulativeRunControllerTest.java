package com.cumulo.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.cumulo.service.core.job.DailyCumulativeJob;
import com.cumulo.service.core.job.MonthlyArrayRewindService;
import com.cumulo.service.core.job.RunReport;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class CumulativeRunControllerTest {

    private static final LocalDate AS_OF = LocalDate.of(2023, 3, 31);

    @Mock
    private DailyCumulativeJob job;

    @Mock
    private MonthlyArrayRewindService rewindService;

    private CumulativeRunController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        controller = new CumulativeRunController(job, rewindService);
    }

    @Test
    void runDelegatesToJob() {
        RunReport report = new RunReport(AS_OF, 1, 2, 3, 6, 4, List.of());
        when(job.run(AS_OF)).thenReturn(report);

        assertThat(controller.run(AS_OF)).isEqualTo(report);
    }

    @Test
    void rewindReportsArrayCount() {
        when(rewindService.rewind(AS_OF)).thenReturn(5);

        Map<String, Object> body = controller.rewind(AS_OF);

        assertThat(body).containsEntry("fromDate", "2023-03-31").containsEntry("arraysRewound", 5);
    }
}
