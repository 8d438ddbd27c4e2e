package com.company.casemanagement.service;

import com.company.casemanagement.domain.CaseEscalation;
import com.company.casemanagement.domain.EscalationRule;
import com.company.casemanagement.domain.RepairCase;
import com.company.casemanagement.domain.enums.EscalationType;
import com.company.casemanagement.event.SlaEscalationTriggeredEvent;
import com.company.casemanagement.repository.CaseEscalationRepository;
import com.company.casemanagement.repository.RepairCaseRepository;
import com.company.casemanagement.util.SlaEvaluationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SlaEscalationService {

    private final CaseEscalationRepository escalationRepository;
    private final RepairCaseRepository repairCaseRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    /**
     * Record the escalation and the case bookkeeping in one transaction,
     * then announce it for asynchronous notification
     */
    @Transactional
    public CaseEscalation escalate(RepairCase repairCase, EscalationRule rule, SlaEvaluationResult result) {
        EscalationType type = rule.getEscalationType() != null
                ? rule.getEscalationType()
                : EscalationType.forStatus(result.getStatus());

        CaseEscalation escalation = CaseEscalation.builder()
                .caseId(repairCase.getId())
                .escalationLevel(rule.getLevel())
                .escalationType(type.getValue())
                .reason(result.getBreachReason() != null
                        ? result.getBreachReason()
                        : "SLA " + result.getStatus().getValue())
                .slaStatus(toJson(result))
                .escalatedBy("system")
                .build();

        CaseEscalation saved = escalationRepository.save(escalation);
        repairCaseRepository.updateEscalationInfo(repairCase.getId(), result.getStatus().getValue(), rule.getLevel());

        meterRegistry.counter("sla.escalations",
                "type", type.getValue(),
                "level", String.valueOf(rule.getLevel())
        ).increment();

        log.warn("Escalated case {} to level {} ({}): {}",
                repairCase.getCaseNumber(), rule.getLevel(), type.getValue(), saved.getReason());

        List<String> notifyRoles = rule.getNotifyRoles() != null ? rule.getNotifyRoles() : List.of();
        eventPublisher.publishEvent(new SlaEscalationTriggeredEvent(repairCase, saved, type, notifyRoles, result));

        return saved;
    }

    private String toJson(SlaEvaluationResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize SLA evaluation for case " + result.getCaseId(), e);
        }
    }
}
