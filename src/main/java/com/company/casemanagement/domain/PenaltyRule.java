package com.company.casemanagement.domain;

import com.company.casemanagement.domain.enums.BreachType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One entry of sla_definitions.penalty_rules (JSONB)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PenaltyRule {
    private BreachType breachType;
    private BigDecimal penaltyPercentage;
    private BigDecimal maxPenaltyAmount;
    private Double gracePeriodHours;
}
