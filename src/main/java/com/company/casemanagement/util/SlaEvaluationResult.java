package com.company.casemanagement.util;

import com.company.casemanagement.domain.enums.SlaComplianceStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaEvaluationResult {
    private UUID caseId;
    private UUID slaId;
    private double responseTimeTarget;
    private Double responseTimeActual;
    private double resolutionTimeTarget;
    private Double resolutionTimeActual;
    private SlaComplianceStatus status;
    private String breachReason;
    private BigDecimal penaltyAmount;

    @JsonIgnore
    public boolean isBreached() {
        return status == SlaComplianceStatus.BREACHED;
    }

    @JsonIgnore
    public boolean isAtRisk() {
        return status == SlaComplianceStatus.AT_RISK;
    }
}
