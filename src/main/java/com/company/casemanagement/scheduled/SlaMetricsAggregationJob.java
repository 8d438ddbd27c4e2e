package com.company.casemanagement.scheduled;

import com.company.casemanagement.domain.SlaDefinition;
import com.company.casemanagement.domain.SlaMetrics;
import com.company.casemanagement.repository.SlaDefinitionRepository;
import com.company.casemanagement.repository.SlaMetricsRepository;
import com.company.casemanagement.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "casemanagement.sla-metrics.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class SlaMetricsAggregationJob {

    private final SlaDefinitionRepository slaDefinitionRepository;
    private final SlaMetricsRepository slaMetricsRepository;
    private final Clock clock;

    /**
     * Roll up yesterday's (UTC) cases per active SLA, daily at 01:30
     */
    @Scheduled(cron = "${casemanagement.sla-metrics.cron:0 30 1 * * *}", zone = "UTC")
    public void aggregateDailySlaMetrics() {
        LocalDate day = LocalDate.now(clock.withZone(ZoneOffset.UTC)).minusDays(1);
        aggregateForDay(day);
    }

    public void aggregateForDay(LocalDate day) {
        log.info("Starting SLA metrics aggregation for {}", day);

        List<SlaDefinition> definitions = slaDefinitionRepository.findAllActive();

        int successCount = 0;
        int failureCount = 0;

        for (SlaDefinition definition : definitions) {
            try {
                aggregateForSla(definition.getId(), day);
                successCount++;
            } catch (Exception e) {
                log.error("Failed to aggregate SLA metrics for SLA {}", definition.getId(), e);
                failureCount++;
            }
        }

        log.info("SLA metrics aggregation for {} completed: {} succeeded, {} failed",
                day, successCount, failureCount);
    }

    private void aggregateForSla(UUID slaId, LocalDate day) {
        Instant from = TimeUtils.startOfDayUtc(day);
        Instant to = TimeUtils.startOfDayUtc(day.plusDays(1));

        Map<String, Object> stats = slaMetricsRepository.aggregateCompliance(slaId, from, to);

        int total = getIntValue(stats, "total_cases");
        int met = getIntValue(stats, "met_cases");

        SlaMetrics metrics = SlaMetrics.builder()
                .slaId(slaId)
                .periodStart(day)
                .periodEnd(day)
                .totalCases(total)
                .metCases(met)
                .breachedCases(getIntValue(stats, "breached_cases"))
                .complianceRate(complianceRate(met, total))
                .avgResponseTimeHours(getBigDecimalValue(stats, "avg_response_time_hours"))
                .avgResolutionTimeHours(getBigDecimalValue(stats, "avg_resolution_time_hours"))
                .build();

        slaMetricsRepository.upsert(metrics);

        log.debug("SLA {} on {}: {} cases, {} breached, compliance {}%",
                slaId, day, total, metrics.getBreachedCases(), metrics.getComplianceRate());
    }

    private BigDecimal complianceRate(int met, int total) {
        if (total == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(met * 100L)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }

    private int getIntValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return 0;
    }

    private BigDecimal getBigDecimalValue(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).setScale(2, RoundingMode.HALF_UP);
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).doubleValue()).setScale(2, RoundingMode.HALF_UP);
        }
        return null;
    }
}
