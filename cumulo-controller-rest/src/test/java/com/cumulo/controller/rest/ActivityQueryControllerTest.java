package com.cumulo.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.cumulo.service.core.query.ActivityQueryService;
import com.cumulo.service.core.window.WindowSummary;
import java.time.LocalDate;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ActivityQueryControllerTest {

    private static final LocalDate AS_OF = LocalDate.of(2023, 3, 31);

    @Mock
    private ActivityQueryService queryService;

    private ActivityQueryController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        controller = new ActivityQueryController(queryService);
    }

    @Test
    void returnsSummaryForKnownEntity() {
        WindowSummary summary = new WindowSummary("u1", AS_OF, null, true, true, false, 2, 5, 3L, "11");
        when(queryService.summarize("u1", AS_OF, null)).thenReturn(Optional.of(summary));

        ResponseEntity<WindowSummary> response = controller.summary("u1", AS_OF, null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(summary);
    }

    @Test
    void unknownEntityIsNotFound() {
        when(queryService.summarize("ghost", AS_OF, "web")).thenReturn(Optional.empty());

        ResponseEntity<WindowSummary> response = controller.summary("ghost", AS_OF, "web");

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody()).isNull();
    }
}
