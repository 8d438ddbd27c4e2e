package com.company.casemanagement.controller;

import com.company.casemanagement.dto.response.SlaMonitoringRunResponse;
import com.company.casemanagement.dto.response.SlaMonitoringStatusResponse;
import com.company.casemanagement.scheduled.ScheduledJobsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/admin/sla-monitoring")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "SLA Monitoring", description = "Manual trigger and status of the SLA monitoring job")
public class SlaMonitoringController {

    private final ScheduledJobsService scheduledJobsService;

    @PostMapping("/run")
    @Operation(summary = "Run an SLA monitoring pass now",
            description = "Runs synchronously and returns the summary together with per-case results")
    public ResponseEntity<SlaMonitoringRunResponse> runSlaMonitoring() {
        log.info("Manual SLA monitoring triggered via API");
        return ResponseEntity.ok(scheduledJobsService.runManually());
    }

    @GetMapping("/status")
    @Operation(summary = "Get SLA monitoring job status")
    public ResponseEntity<SlaMonitoringStatusResponse> getStatus() {
        return ResponseEntity.ok(scheduledJobsService.getStatus());
    }
}
