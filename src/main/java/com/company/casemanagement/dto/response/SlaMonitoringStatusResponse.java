package com.company.casemanagement.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaMonitoringStatusResponse {
    private boolean enabled;
    private boolean running;
    private int intervalMinutes;
    private SlaMonitoringSummary lastRun; // null until the first completed cycle
}
