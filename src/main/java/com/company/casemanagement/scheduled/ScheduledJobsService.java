package com.company.casemanagement.scheduled;

import com.company.casemanagement.config.SlaMonitoringProperties;
import com.company.casemanagement.dto.response.SlaMonitoringResult;
import com.company.casemanagement.dto.response.SlaMonitoringRunResponse;
import com.company.casemanagement.dto.response.SlaMonitoringStatusResponse;
import com.company.casemanagement.dto.response.SlaMonitoringSummary;
import com.company.casemanagement.service.SlaMonitoringService;
import com.company.casemanagement.util.TimeUtils;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic SLA monitoring. One fixed-rate timer whose first run fires as soon as it is armed,
 * plus a manual trigger that runs on the caller's thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledJobsService {

    private static final String MDC_RUN_KEY = "slaCheckRun";
    private static final int RECOMMENDED_MIN_INTERVAL_MINUTES = 5;

    private final SlaMonitoringService slaMonitoringService;
    private final SlaMonitoringProperties properties;
    private final TaskScheduler taskScheduler;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    // Shared by the timer and manual paths
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);

    // Guarded by this
    private ScheduledFuture<?> slaMonitoringHandle;

    private volatile SlaMonitoringSummary lastRunSummary;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        start();
    }

    public synchronized void start() {
        if (slaMonitoringHandle != null) {
            log.warn("SLA monitoring job already started, ignoring start request");
            return;
        }

        if (!properties.isEnableSlaMonitoring()) {
            log.info("SLA monitoring is disabled, no job scheduled");
            return;
        }

        int intervalMinutes = properties.getCheckIntervalMinutes();
        if (intervalMinutes < RECOMMENDED_MIN_INTERVAL_MINUTES) {
            log.warn("SLA check interval of {} minutes is below the recommended {} minutes and may load the database",
                    intervalMinutes, RECOMMENDED_MIN_INTERVAL_MINUTES);
        }

        Duration period = Duration.ofMillis(TimeUtils.minutesToMillis(intervalMinutes));

        // First execution at "now" dispatches the immediate run to the scheduler thread
        slaMonitoringHandle = taskScheduler.scheduleAtFixedRate(
                this::runScheduledSlaCheck,
                taskScheduler.getClock().instant(),
                period);

        log.info("SLA monitoring job started: intervalMinutes={} periodMs={}", intervalMinutes, period.toMillis());
    }

    /**
     * Disarm the timer. An in-flight cycle is left to finish.
     */
    @PreDestroy
    public synchronized void stop() {
        if (slaMonitoringHandle == null) {
            return;
        }

        slaMonitoringHandle.cancel(false);
        slaMonitoringHandle = null;
        log.info("SLA monitoring job stopped");
    }

    /**
     * Run one pass now, on the calling thread. Failures reach the caller.
     */
    public SlaMonitoringRunResponse runManually() {
        log.info("Manual SLA monitoring run requested");

        boolean acquired = cycleInFlight.compareAndSet(false, true);
        try {
            return runCycle("manual");
        } catch (RuntimeException e) {
            meterRegistry.counter("sla.monitoring.failures", "trigger", "manual").increment();
            log.error("Manual SLA monitoring run failed", e);
            throw e;
        } finally {
            if (acquired) {
                cycleInFlight.set(false);
            }
        }
    }

    public synchronized SlaMonitoringStatusResponse getStatus() {
        return SlaMonitoringStatusResponse.builder()
                .enabled(properties.isEnableSlaMonitoring())
                .running(slaMonitoringHandle != null)
                .intervalMinutes(properties.getCheckIntervalMinutes())
                .lastRun(lastRunSummary)
                .build();
    }

    /**
     * Timer entry point. Never throws, so the fixed-rate task stays armed.
     */
    void runScheduledSlaCheck() {
        if (!cycleInFlight.compareAndSet(false, true)) {
            log.warn("Previous SLA monitoring cycle still running, skipping this tick");
            meterRegistry.counter("sla.monitoring.skipped").increment();
            return;
        }

        try {
            runCycle("scheduled");
        } catch (Exception e) {
            meterRegistry.counter("sla.monitoring.failures", "trigger", "scheduled").increment();
            log.error("Scheduled SLA monitoring failed", e);
        } finally {
            cycleInFlight.set(false);
        }
    }

    private SlaMonitoringRunResponse runCycle(String trigger) {
        MDC.put(MDC_RUN_KEY, UUID.randomUUID().toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        Instant startTime = clock.instant();

        try {
            meterRegistry.counter("sla.monitoring.runs", "trigger", trigger).increment();

            List<SlaMonitoringResult> results = slaMonitoringService.monitorSlaCompliance();

            Instant endTime = clock.instant();
            SlaMonitoringSummary summary = SlaMonitoringSummary.from(
                    results, Duration.between(startTime, endTime).toMillis(), endTime);

            lastRunSummary = summary;
            logSummary(trigger, summary);

            return SlaMonitoringRunResponse.builder()
                    .summary(summary)
                    .results(results)
                    .build();
        } finally {
            sample.stop(meterRegistry.timer("sla.monitoring.duration", "trigger", trigger));
            MDC.remove(MDC_RUN_KEY);
        }
    }

    private void logSummary(String trigger, SlaMonitoringSummary summary) {
        if (summary.hasIssues()) {
            log.warn("SLA monitoring found issues: trigger={} totalCasesChecked={} escalationsTriggered={} "
                            + "breachedCases={} atRiskCases={} duration={}",
                    trigger, summary.getTotalCasesChecked(), summary.getEscalationsTriggered(),
                    summary.getBreachedCases(), summary.getAtRiskCases(),
                    TimeUtils.formatDuration(summary.getDurationMs()));
        } else {
            log.info("SLA monitoring completed: trigger={} totalCasesChecked={} atRiskCases={} duration={}",
                    trigger, summary.getTotalCasesChecked(), summary.getAtRiskCases(),
                    TimeUtils.formatDuration(summary.getDurationMs()));
        }
    }
}
