package com.dailycode.interfaces.api.run;

import com.dailycode.application.delivery.RunReport;
import com.dailycode.infrastructure.scheduling.DeliveryTriggerScheduler;
import com.dailycode.infrastructure.scheduling.RunReportStore;
import com.dailycode.infrastructure.scheduling.SchedulerStatus;
import com.dailycode.infrastructure.scheduling.TriggerResult;
import com.dailycode.interfaces.api.dto.ErrorResponse;
import com.dailycode.interfaces.api.dto.TriggerResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/runs")
@RequiredArgsConstructor
public class RunController {

    private final DeliveryTriggerScheduler triggerScheduler;
    private final RunReportStore reportStore;

    /**
     * Synchronous manual trigger. Responds 409 when a run is already in progress.
     */
    @PostMapping
    public ResponseEntity<?> trigger() {
        TriggerResult result = triggerScheduler.triggerNow();
        return switch (result.status()) {
            case COMPLETED -> ResponseEntity.ok(TriggerResponse.from(result));
            case SKIPPED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(new ErrorResponse("RUN_IN_PROGRESS", "A delivery run is already in progress."));
            case FAILED -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new ErrorResponse("RUN_ABORTED", result.error().getMessage()));
        };
    }

    @GetMapping
    public ResponseEntity<List<RunReport>> recent() {
        return ResponseEntity.ok(reportStore.recent());
    }

    @GetMapping("/schedule")
    public ResponseEntity<SchedulerStatus> schedule() {
        return ResponseEntity.ok(triggerScheduler.status());
    }
}
