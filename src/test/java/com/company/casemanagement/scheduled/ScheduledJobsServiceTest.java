package com.company.casemanagement.scheduled;

import com.company.casemanagement.config.SlaMonitoringProperties;
import com.company.casemanagement.domain.enums.SlaComplianceStatus;
import com.company.casemanagement.dto.response.SlaMonitoringResult;
import com.company.casemanagement.dto.response.SlaMonitoringRunResponse;
import com.company.casemanagement.service.SlaMonitoringService;
import com.company.casemanagement.util.SlaEvaluationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ScheduledJobsServiceTest {

    private static final Instant START = Instant.parse("2026-03-02T08:00:00Z");
    private static final int INTERVAL_MINUTES = 15;

    private SlaMonitoringService slaMonitoringService;
    private SlaMonitoringProperties properties;
    private ManualTaskScheduler scheduler;
    private SimpleMeterRegistry meterRegistry;
    private ScheduledJobsService service;

    @BeforeEach
    void setUp() {
        slaMonitoringService = Mockito.mock(SlaMonitoringService.class);
        properties = new SlaMonitoringProperties();
        properties.setEnableSlaMonitoring(true);
        properties.setCheckIntervalMinutes(INTERVAL_MINUTES);
        scheduler = new ManualTaskScheduler(START);
        meterRegistry = new SimpleMeterRegistry();

        service = new ScheduledJobsService(
                slaMonitoringService, properties, scheduler, meterRegistry, scheduler.getClock());

        when(slaMonitoringService.monitorSlaCompliance()).thenReturn(List.of());
    }

    @Test
    void stopIsSafeBeforeStartAndWhenRepeated() {
        service.stop();
        assertThat(service.getStatus().isRunning()).isFalse();

        service.start();
        assertThat(service.getStatus().isRunning()).isTrue();

        service.stop();
        service.stop();

        assertThat(service.getStatus().isRunning()).isFalse();
        scheduler.advance(Duration.ofHours(2));
        verifyNoInteractions(slaMonitoringService);
    }

    @Test
    void startDispatchesTheFirstRunWithoutWaitingForIt() {
        service.start();

        // Armed but not yet executed on the caller's thread
        verifyNoInteractions(slaMonitoringService);

        scheduler.advance(Duration.ZERO);

        verify(slaMonitoringService, times(1)).monitorSlaCompliance();
        assertThat(meterRegistry.counter("sla.monitoring.runs", "trigger", "scheduled").count()).isEqualTo(1.0);
    }

    @Test
    void runsOncePlusOncePerElapsedInterval() {
        service.start();

        scheduler.advance(Duration.ofMinutes(INTERVAL_MINUTES * 4L));
        verify(slaMonitoringService, times(5)).monitorSlaCompliance();

        // Just short of the next tick
        scheduler.advance(Duration.ofMinutes(INTERVAL_MINUTES - 1));
        verify(slaMonitoringService, times(5)).monitorSlaCompliance();

        scheduler.advance(Duration.ofMinutes(1));
        verify(slaMonitoringService, times(6)).monitorSlaCompliance();
    }

    @Test
    void scheduledFailuresAreContainedAndTheTimerStaysArmed() {
        when(slaMonitoringService.monitorSlaCompliance())
                .thenThrow(new IllegalStateException("database unavailable"));

        service.start();
        scheduler.advance(Duration.ofMinutes(INTERVAL_MINUTES * 3L));

        verify(slaMonitoringService, times(4)).monitorSlaCompliance();
        assertThat(service.getStatus().isRunning()).isTrue();
        assertThat(meterRegistry.counter("sla.monitoring.failures", "trigger", "scheduled").count()).isEqualTo(4.0);
        assertThat(service.getStatus().getLastRun()).isNull();
    }

    @Test
    void manualRunPropagatesTheSameFailure() {
        IllegalStateException failure = new IllegalStateException("case query failed");
        when(slaMonitoringService.monitorSlaCompliance()).thenThrow(failure);

        assertThatThrownBy(() -> service.runManually()).isSameAs(failure);
        assertThat(meterRegistry.counter("sla.monitoring.failures", "trigger", "manual").count()).isEqualTo(1.0);

        // The in-flight flag was released, so the timer path still runs afterwards
        doReturn(List.of()).when(slaMonitoringService).monitorSlaCompliance();
        service.runScheduledSlaCheck();
        assertThat(meterRegistry.counter("sla.monitoring.skipped").count()).isZero();
        assertThat(meterRegistry.counter("sla.monitoring.runs", "trigger", "scheduled").count()).isEqualTo(1.0);
    }

    @Test
    void manualRunReturnsSummaryAndResultsAndRecordsLastRun() {
        SlaMonitoringResult breached = result(SlaComplianceStatus.BREACHED, true);
        SlaMonitoringResult onTrack = result(SlaComplianceStatus.ON_TRACK, false);
        when(slaMonitoringService.monitorSlaCompliance()).thenReturn(List.of(breached, onTrack));

        SlaMonitoringRunResponse response = service.runManually();

        assertThat(response.getResults()).containsExactly(breached, onTrack);
        assertThat(response.getSummary().getTotalCasesChecked()).isEqualTo(2);
        assertThat(response.getSummary().getBreachedCases()).isEqualTo(1);
        assertThat(response.getSummary().getEscalationsTriggered()).isEqualTo(1);
        assertThat(response.getSummary().getTimestamp()).isEqualTo(START);
        assertThat(service.getStatus().getLastRun()).isEqualTo(response.getSummary());
    }

    @Test
    void timerTickIsSkippedWhileAnotherCycleIsInFlight() {
        AtomicBoolean nested = new AtomicBoolean(false);
        when(slaMonitoringService.monitorSlaCompliance()).thenAnswer(invocation -> {
            if (!nested.getAndSet(true)) {
                service.runScheduledSlaCheck();
            }
            return List.of();
        });

        service.runManually();

        verify(slaMonitoringService, times(1)).monitorSlaCompliance();
        assertThat(meterRegistry.counter("sla.monitoring.skipped").count()).isEqualTo(1.0);
    }

    @Test
    void startDoesNothingWhenMonitoringIsDisabled() {
        properties.setEnableSlaMonitoring(false);

        service.start();

        assertThat(scheduler.scheduledTaskCount()).isZero();
        assertThat(service.getStatus().isRunning()).isFalse();
        assertThat(service.getStatus().isEnabled()).isFalse();
    }

    @Test
    void secondStartKeepsTheExistingTimer() {
        service.start();
        service.start();

        assertThat(scheduler.scheduledTaskCount()).isEqualTo(1);

        scheduler.advance(Duration.ZERO);
        verify(slaMonitoringService, times(1)).monitorSlaCompliance();
    }

    @Test
    void statusReportsConfiguredInterval() {
        assertThat(service.getStatus().getIntervalMinutes()).isEqualTo(INTERVAL_MINUTES);
        assertThat(service.getStatus().isEnabled()).isTrue();
    }

    private static SlaMonitoringResult result(SlaComplianceStatus status, boolean escalated) {
        UUID caseId = UUID.randomUUID();
        return SlaMonitoringResult.builder()
                .caseId(caseId)
                .slaStatus(SlaEvaluationResult.builder().caseId(caseId).status(status).build())
                .escalationTriggered(escalated)
                .escalationLevel(escalated ? 1 : null)
                .build();
    }
}
