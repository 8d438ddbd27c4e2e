package com.company.casemanagement.service;

import com.company.casemanagement.event.SlaEscalationTriggeredEvent;
import com.company.casemanagement.repository.CaseEscalationRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;

@Service
@Slf4j
@RequiredArgsConstructor
public class EscalationNotificationService {

    private final EscalationAlertSender alertSender;
    private final CaseEscalationRepository escalationRepository;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /**
     * Runs after the escalation commits, off the monitoring thread
     */
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    @Async
    public void handleEscalation(SlaEscalationTriggeredEvent event) {
        log.info("Notifying escalation {} for case {}",
                event.getEscalation().getId(), event.getRepairCase().getCaseNumber());

        try {
            if (!alertSender.sendAlert(event)) {
                return;
            }

            escalationRepository.markNotified(event.getEscalation().getId(), clock.instant());

            meterRegistry.counter("sla.escalation.alerts.sent",
                    "type", event.getEscalationType().getValue()
            ).increment();

        } catch (Exception e) {
            log.error("Failed to complete notification for escalation {}",
                    event.getEscalation().getId(), e);

            meterRegistry.counter("sla.escalation.alerts.failed",
                    "type", event.getEscalationType().getValue()
            ).increment();
        }
    }
}
