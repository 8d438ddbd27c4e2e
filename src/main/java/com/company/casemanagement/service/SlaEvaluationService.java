package com.company.casemanagement.service;

import com.company.casemanagement.config.SlaMonitoringProperties;
import com.company.casemanagement.domain.EscalationRule;
import com.company.casemanagement.domain.PenaltyRule;
import com.company.casemanagement.domain.RepairCase;
import com.company.casemanagement.domain.SlaDefinition;
import com.company.casemanagement.domain.enums.BreachType;
import com.company.casemanagement.domain.enums.SlaComplianceStatus;
import com.company.casemanagement.util.SlaEvaluationResult;
import com.company.casemanagement.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Pure SLA arithmetic for a single case. Reads the clock, never the database.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SlaEvaluationService {

    private static final String RESPONSE_EXCEEDED = "Response time exceeded";
    private static final String RESOLUTION_EXCEEDED = "Resolution time exceeded";

    private final SlaMonitoringProperties properties;
    private final Clock clock;

    public SlaEvaluationResult evaluate(RepairCase repairCase, SlaDefinition sla) {
        if (sla == null) {
            return SlaEvaluationResult.builder()
                    .caseId(repairCase.getId())
                    .status(SlaComplianceStatus.ON_TRACK)
                    .penaltyAmount(BigDecimal.ZERO)
                    .build();
        }

        double elapsedHours = elapsedHours(repairCase);
        double responseTarget = hoursOrZero(sla.getResponseTimeHours());
        double resolutionTarget = hoursOrZero(sla.getResolutionTimeHours());

        // Response: measured once the case has left created/open
        Double responseActual = null;
        boolean responseBreached;
        if (repairCase.hasResponded()) {
            Instant respondedAt = repairCase.getAssignedAt() != null
                    ? repairCase.getAssignedAt()
                    : repairCase.getUpdatedAt();
            responseActual = TimeUtils.hoursBetween(repairCase.getCreatedAt(), respondedAt);
            responseBreached = responseActual > responseTarget;
        } else {
            responseBreached = elapsedHours > responseTarget;
        }

        Double resolutionActual = null;
        boolean resolutionBreached;
        if (repairCase.isCompleted()) {
            resolutionActual = repairCase.getCompletedAt() != null
                    ? TimeUtils.hoursBetween(repairCase.getCreatedAt(), repairCase.getCompletedAt())
                    : elapsedHours;
            resolutionBreached = resolutionActual > resolutionTarget;
        } else {
            resolutionBreached = elapsedHours > resolutionTarget;
        }

        List<String> breachReasons = new ArrayList<>();
        if (responseBreached) breachReasons.add(RESPONSE_EXCEEDED);
        if (resolutionBreached) breachReasons.add(RESOLUTION_EXCEEDED);

        SlaComplianceStatus status;
        if (!breachReasons.isEmpty()) {
            status = SlaComplianceStatus.BREACHED;
        } else if (isAtRisk(responseActual != null ? responseActual : elapsedHours, responseTarget)
                || isAtRisk(resolutionActual != null ? resolutionActual : elapsedHours, resolutionTarget)) {
            status = SlaComplianceStatus.AT_RISK;
        } else {
            status = SlaComplianceStatus.ON_TRACK;
        }

        BigDecimal penalty = BigDecimal.ZERO;
        if (properties.isPenaltyCalculationEnabled() && status == SlaComplianceStatus.BREACHED) {
            double responseOverrun = (responseActual != null ? responseActual : elapsedHours) - responseTarget;
            double resolutionOverrun = (resolutionActual != null ? resolutionActual : elapsedHours) - resolutionTarget;
            penalty = calculatePenalty(repairCase, sla.getPenaltyRules(),
                    responseBreached ? responseOverrun : 0,
                    resolutionBreached ? resolutionOverrun : 0);
        }

        return SlaEvaluationResult.builder()
                .caseId(repairCase.getId())
                .slaId(sla.getId())
                .responseTimeTarget(responseTarget)
                .responseTimeActual(responseActual)
                .resolutionTimeTarget(resolutionTarget)
                .resolutionTimeActual(resolutionActual)
                .status(status)
                .breachReason(breachReasons.isEmpty() ? null : String.join("; ", breachReasons))
                .penaltyAmount(penalty)
                .build();
    }

    /**
     * Lowest escalation rule above {@code lastEscalationLevel} whose trigger time has passed
     */
    public Optional<EscalationRule> findDueEscalation(RepairCase repairCase, SlaDefinition sla, int lastEscalationLevel) {
        if (sla == null || sla.getEscalationRules() == null || sla.getEscalationRules().isEmpty()) {
            return Optional.empty();
        }

        double elapsedHours = elapsedHours(repairCase);

        return sla.getEscalationRules().stream()
                .filter(rule -> rule.getLevel() > lastEscalationLevel)
                .filter(rule -> elapsedHours >= rule.getTriggerAfterHours())
                .min(Comparator.comparingInt(EscalationRule::getLevel));
    }

    public Instant nextCheckTime() {
        return clock.instant().plus(Duration.ofMinutes(properties.getCheckIntervalMinutes()));
    }

    private double elapsedHours(RepairCase repairCase) {
        return TimeUtils.hoursBetween(repairCase.getCreatedAt(), clock.instant());
    }

    private boolean isAtRisk(double consumedHours, double targetHours) {
        return targetHours > 0 && consumedHours / targetHours > properties.getAtRiskThreshold();
    }

    private BigDecimal calculatePenalty(RepairCase repairCase, List<PenaltyRule> rules,
                                        double responseOverrunHours, double resolutionOverrunHours) {
        if (rules == null || rules.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal caseValue = repairCase.getEstimatedValue() != null
                ? repairCase.getEstimatedValue()
                : properties.getDefaultCaseValue();

        BigDecimal total = BigDecimal.ZERO;
        for (PenaltyRule rule : rules) {
            if (rule.getPenaltyPercentage() == null) {
                continue;
            }
            double overrun = rule.getBreachType() == BreachType.RESPONSE
                    ? responseOverrunHours
                    : resolutionOverrunHours;
            double grace = rule.getGracePeriodHours() != null ? rule.getGracePeriodHours() : 0;
            if (overrun <= 0 || overrun <= grace) {
                continue;
            }

            BigDecimal amount = caseValue.multiply(rule.getPenaltyPercentage())
                    .divide(BigDecimal.valueOf(100), 2, RoundingMode.HALF_UP);
            if (rule.getMaxPenaltyAmount() != null && amount.compareTo(rule.getMaxPenaltyAmount()) > 0) {
                amount = rule.getMaxPenaltyAmount();
            }
            total = total.add(amount);
        }

        log.debug("Penalty for case {}: {}", repairCase.getId(), total);
        return total;
    }

    private static double hoursOrZero(Integer hours) {
        return hours != null ? hours : 0;
    }
}
