package com.company.casemanagement.service;

import com.company.casemanagement.config.SlaMonitoringProperties;
import com.company.casemanagement.domain.EscalationRule;
import com.company.casemanagement.domain.RepairCase;
import com.company.casemanagement.domain.SlaDefinition;
import com.company.casemanagement.dto.response.SlaMonitoringResult;
import com.company.casemanagement.exception.CaseNotFoundException;
import com.company.casemanagement.repository.CaseEscalationRepository;
import com.company.casemanagement.repository.RepairCaseRepository;
import com.company.casemanagement.repository.SlaDefinitionRepository;
import com.company.casemanagement.util.SlaEvaluationResult;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class SlaMonitoringService {

    private final RepairCaseRepository repairCaseRepository;
    private final SlaDefinitionRepository slaDefinitionRepository;
    private final CaseEscalationRepository escalationRepository;
    private final SlaEvaluationService evaluationService;
    private final SlaEscalationService escalationService;
    private final SlaMonitoringProperties properties;
    private final MeterRegistry meterRegistry;

    /**
     * One pass over every open case due for a check. A case that fails is logged and
     * left out of the results; failing to load the cases fails the pass.
     */
    public List<SlaMonitoringResult> monitorSlaCompliance() {
        if (!properties.isEnableSlaMonitoring()) {
            log.debug("SLA monitoring is disabled");
            return List.of();
        }

        List<RepairCase> cases = repairCaseRepository.findActiveCasesForSlaMonitoring(
                properties.getCheckIntervalMinutes());

        log.info("Checking SLA compliance for {} active cases", cases.size());

        List<SlaMonitoringResult> results = new ArrayList<>(cases.size());
        for (RepairCase repairCase : cases) {
            try {
                results.add(monitorCase(repairCase));
            } catch (Exception e) {
                log.error("Failed to monitor SLA for case {}", repairCase.getId(), e);
                meterRegistry.counter("sla.monitoring.case_failures").increment();
            }
        }

        return results;
    }

    /**
     * Evaluate a single case on demand. Never escalates or writes.
     */
    public SlaMonitoringResult checkCase(UUID caseId) {
        RepairCase repairCase = repairCaseRepository.findById(caseId)
                .orElseThrow(() -> new CaseNotFoundException(caseId));

        SlaDefinition sla = resolveSla(repairCase).orElse(null);
        int lastLevel = escalationRepository.findLastEscalationLevel(caseId);

        SlaEvaluationResult result = evaluationService.evaluate(repairCase, sla);
        Optional<EscalationRule> due = evaluationService.findDueEscalation(repairCase, sla, lastLevel);

        return SlaMonitoringResult.builder()
                .caseId(caseId)
                .slaStatus(result)
                .escalationTriggered(false)
                .escalationLevel(due.map(EscalationRule::getLevel).orElse(null))
                .nextCheckTime(evaluationService.nextCheckTime())
                .build();
    }

    private SlaMonitoringResult monitorCase(RepairCase repairCase) {
        SlaDefinition sla = resolveSla(repairCase).orElse(null);
        int lastLevel = escalationRepository.findLastEscalationLevel(repairCase.getId());

        SlaEvaluationResult result = evaluationService.evaluate(repairCase, sla);
        Optional<EscalationRule> due = evaluationService.findDueEscalation(repairCase, sla, lastLevel);

        boolean escalated = false;
        if (due.isPresent() && properties.isEscalationEnabled()) {
            escalated = tryEscalate(repairCase, due.get(), result);
        }

        // Escalation already stored the status together with its bookkeeping
        String computedStatus = result.getStatus().getValue();
        if (!escalated && !computedStatus.equals(repairCase.getSlaStatus())) {
            repairCaseRepository.updateSlaStatus(repairCase.getId(), computedStatus);
        }

        if (result.isBreached()) {
            log.warn("SLA breached for case {}: {}", repairCase.getCaseNumber(), result.getBreachReason());
        }

        return SlaMonitoringResult.builder()
                .caseId(repairCase.getId())
                .slaStatus(result)
                .escalationTriggered(escalated)
                .escalationLevel(due.map(EscalationRule::getLevel).orElse(null))
                .nextCheckTime(evaluationService.nextCheckTime())
                .build();
    }

    private boolean tryEscalate(RepairCase repairCase, EscalationRule rule, SlaEvaluationResult result) {
        try {
            escalationService.escalate(repairCase, rule, result);
            return true;
        } catch (Exception e) {
            log.error("Failed to escalate case {} to level {}", repairCase.getId(), rule.getLevel(), e);
            meterRegistry.counter("sla.escalations.failed").increment();
            return false;
        }
    }

    /**
     * The case's own SLA when active, otherwise the best default for its tier and service type
     */
    private Optional<SlaDefinition> resolveSla(RepairCase repairCase) {
        if (repairCase.getSlaId() != null) {
            Optional<SlaDefinition> own = slaDefinitionRepository.findActiveById(repairCase.getSlaId());
            if (own.isPresent()) {
                return own;
            }
            log.debug("SLA {} of case {} is not active, falling back to defaults",
                    repairCase.getSlaId(), repairCase.getId());
        }

        String tier = repairCase.getCustomerTier() != null
                ? repairCase.getCustomerTier()
                : properties.getDefaultCustomerTier();
        String serviceType = repairCase.getServiceType() != null
                ? repairCase.getServiceType()
                : properties.getDefaultServiceType();

        return slaDefinitionRepository.findDefault(tier, serviceType);
    }
}
