package com.company.casemanagement.repository;

import com.company.casemanagement.domain.SlaMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaMetricsRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Raw compliance figures for cases bound to one SLA and created in [from, to)
     */
    public Map<String, Object> aggregateCompliance(UUID slaId, Instant from, Instant to) {
        String sql = """
            SELECT
                COUNT(*) AS total_cases,
                COUNT(*) FILTER (WHERE sla_status IS DISTINCT FROM 'breached') AS met_cases,
                COUNT(*) FILTER (WHERE sla_status = 'breached') AS breached_cases,
                AVG(EXTRACT(EPOCH FROM (assigned_at - created_at)) / 3600)
                    FILTER (WHERE assigned_at IS NOT NULL) AS avg_response_time_hours,
                AVG(EXTRACT(EPOCH FROM (actual_completion_date - created_at)) / 3600)
                    FILTER (WHERE actual_completion_date IS NOT NULL) AS avg_resolution_time_hours
            FROM repair_cases
            WHERE sla_id = ?
            AND deleted_at IS NULL
            AND created_at >= ?
            AND created_at < ?
            """;

        return jdbcTemplate.queryForMap(sql, slaId, Timestamp.from(from), Timestamp.from(to));
    }

    /**
     * Insert or refresh the roll-up for one SLA and period
     */
    public int upsert(SlaMetrics metrics) {
        String sql = """
            INSERT INTO sla_metrics (
                sla_id, period_start, period_end, total_cases, met_cases, breached_cases,
                compliance_rate, avg_response_time_hours, avg_resolution_time_hours
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (sla_id, period_start, period_end) DO UPDATE SET
                total_cases = EXCLUDED.total_cases,
                met_cases = EXCLUDED.met_cases,
                breached_cases = EXCLUDED.breached_cases,
                compliance_rate = EXCLUDED.compliance_rate,
                avg_response_time_hours = EXCLUDED.avg_response_time_hours,
                avg_resolution_time_hours = EXCLUDED.avg_resolution_time_hours
            """;

        return jdbcTemplate.update(sql,
                metrics.getSlaId(),
                Date.valueOf(metrics.getPeriodStart()),
                Date.valueOf(metrics.getPeriodEnd()),
                metrics.getTotalCases(),
                metrics.getMetCases(),
                metrics.getBreachedCases(),
                metrics.getComplianceRate(),
                metrics.getAvgResponseTimeHours(),
                metrics.getAvgResolutionTimeHours()
        );
    }
}
