package com.company.casemanagement.event;

import com.company.casemanagement.domain.CaseEscalation;
import com.company.casemanagement.domain.RepairCase;
import com.company.casemanagement.domain.enums.EscalationType;
import com.company.casemanagement.util.SlaEvaluationResult;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class SlaEscalationTriggeredEvent {
    private final RepairCase repairCase;
    private final CaseEscalation escalation;
    private final EscalationType escalationType;
    private final List<String> notifyRoles;
    private final SlaEvaluationResult result;
}
