package com.company.casemanagement.dto.response;

import com.company.casemanagement.util.SlaEvaluationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one case in one monitoring pass
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaMonitoringResult {
    private UUID caseId;
    private SlaEvaluationResult slaStatus;
    private boolean escalationTriggered;
    private Integer escalationLevel;
    private Instant nextCheckTime;
}
