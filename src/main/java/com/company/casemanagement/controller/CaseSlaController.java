package com.company.casemanagement.controller;

import com.company.casemanagement.dto.response.SlaMonitoringResult;
import com.company.casemanagement.service.SlaMonitoringService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/cases")
@RequiredArgsConstructor
@Tag(name = "Case SLA", description = "SLA compliance of individual repair cases")
public class CaseSlaController {

    private final SlaMonitoringService slaMonitoringService;

    @GetMapping("/{caseId}/sla")
    @Operation(summary = "Evaluate the SLA of one case",
            description = "Read-only: no escalation is triggered and nothing is persisted")
    public ResponseEntity<SlaMonitoringResult> getCaseSla(@PathVariable("caseId") UUID caseId) {
        return ResponseEntity.ok(slaMonitoringService.checkCase(caseId));
    }
}
