package com.company.casemanagement.dto.response;

import com.company.casemanagement.domain.enums.SlaComplianceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaMonitoringSummary {
    private int totalCasesChecked;
    private int escalationsTriggered;
    private int breachedCases;
    private int atRiskCases;
    private long durationMs;
    private Instant timestamp;

    public static SlaMonitoringSummary from(List<SlaMonitoringResult> results, long durationMs, Instant timestamp) {
        return SlaMonitoringSummary.builder()
                .totalCasesChecked(results.size())
                .escalationsTriggered((int) results.stream()
                        .filter(SlaMonitoringResult::isEscalationTriggered)
                        .count())
                .breachedCases(countWithStatus(results, SlaComplianceStatus.BREACHED))
                .atRiskCases(countWithStatus(results, SlaComplianceStatus.AT_RISK))
                .durationMs(durationMs)
                .timestamp(timestamp)
                .build();
    }

    public boolean hasIssues() {
        return breachedCases > 0 || escalationsTriggered > 0;
    }

    private static int countWithStatus(List<SlaMonitoringResult> results, SlaComplianceStatus status) {
        return (int) results.stream()
                .filter(r -> r.getSlaStatus() != null && r.getSlaStatus().getStatus() == status)
                .count();
    }
}
