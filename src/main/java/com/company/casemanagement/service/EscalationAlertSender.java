package com.company.casemanagement.service;

import com.company.casemanagement.domain.CaseEscalation;
import com.company.casemanagement.domain.RepairCase;
import com.company.casemanagement.event.SlaEscalationTriggeredEvent;
import com.company.casemanagement.exception.EscalationAlertException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Publishes an escalation as a trace event for the alerting pipeline
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EscalationAlertSender {

    private final Tracer tracer;
    private final MeterRegistry meterRegistry;

    /**
     * @return true when the alert went out, false when retries were exhausted or the circuit is open
     */
    @Retry(name = "escalationAlert", fallbackMethod = "alertSendFallback")
    @CircuitBreaker(name = "escalationAlert")
    public boolean sendAlert(SlaEscalationTriggeredEvent event) {
        RepairCase repairCase = event.getRepairCase();
        CaseEscalation escalation = event.getEscalation();

        Span span = tracer.spanBuilder("sla.escalation.alert")
                .setSpanKind(SpanKind.INTERNAL)
                .startSpan();

        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("case.id", String.valueOf(repairCase.getId()));
            span.setAttribute("case.number", String.valueOf(repairCase.getCaseNumber()));
            span.setAttribute("case.priority", String.valueOf(repairCase.getPriority()));
            span.setAttribute("escalation.level", escalation.getEscalationLevel());
            span.setAttribute("escalation.type", event.getEscalationType().getValue());
            span.setAttribute("sla.status", event.getResult().getStatus().getValue());
            span.setAttribute(AttributeKey.stringArrayKey("notify.roles"), event.getNotifyRoles());

            span.addEvent("SLA Escalation Triggered",
                    Attributes.of(
                            AttributeKey.stringKey("reason"), String.valueOf(escalation.getReason()),
                            AttributeKey.doubleKey("response_target_hours"), event.getResult().getResponseTimeTarget(),
                            AttributeKey.doubleKey("resolution_target_hours"), event.getResult().getResolutionTimeTarget()
                    ));

            log.info("Escalation alert sent for case {} (level {}, notify {})",
                    repairCase.getCaseNumber(), escalation.getEscalationLevel(), event.getNotifyRoles());
            return true;

        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "Failed to send escalation alert");
            throw new EscalationAlertException("Failed to send escalation alert for case " + repairCase.getId(), e);
        } finally {
            span.end();
        }
    }

    private boolean alertSendFallback(SlaEscalationTriggeredEvent event, Exception e) {
        log.error("Escalation alert for case {} not delivered: {}",
                event.getRepairCase().getId(), e.getMessage());

        meterRegistry.counter("sla.escalation.alerts.failed",
                "type", event.getEscalationType().getValue()
        ).increment();

        return false;
    }
}
