package com.company.casemanagement.domain;

import com.company.casemanagement.domain.enums.EscalationType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One entry of sla_definitions.escalation_rules (JSONB)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class EscalationRule {
    private int level;
    private double triggerAfterHours;
    private EscalationType escalationType;
    private List<String> notifyRoles;
    private List<String> actions;
}
