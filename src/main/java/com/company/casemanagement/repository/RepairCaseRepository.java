package com.company.casemanagement.repository;

import com.company.casemanagement.domain.RepairCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class RepairCaseRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final String SELECT_BASE = """
        SELECT rc.id, rc.case_number, rc.status, rc.priority, rc.service_type,
               rc.customer_id, rc.device_id, rc.sla_id,
               rc.assigned_technician_id, rc.assigned_at, rc.actual_completion_date,
               rc.estimated_value, rc.sla_status, rc.escalation_level, rc.last_sla_check,
               rc.created_at, rc.updated_at,
               c.customer_tier
        FROM repair_cases rc
        LEFT JOIN customers c ON rc.customer_id = c.id
        """;

    /**
     * Open cases due for an SLA check, most urgent first.
     * Cases escalated within the last interval are skipped until it elapses.
     */
    public List<RepairCase> findActiveCasesForSlaMonitoring(int checkIntervalMinutes) {
        String sql = SELECT_BASE + """
            WHERE rc.status NOT IN ('completed', 'cancelled')
            AND rc.deleted_at IS NULL
            AND (rc.last_sla_check IS NULL OR rc.last_sla_check < NOW() - (? * INTERVAL '1 minute'))
            ORDER BY CASE rc.priority
                         WHEN 'urgent' THEN 4
                         WHEN 'high' THEN 3
                         WHEN 'medium' THEN 2
                         ELSE 1
                     END DESC,
                     rc.created_at ASC
            """;

        return jdbcTemplate.query(sql, new RepairCaseRowMapper(), checkIntervalMinutes);
    }

    public Optional<RepairCase> findById(UUID caseId) {
        String sql = SELECT_BASE + " WHERE rc.id = ? AND rc.deleted_at IS NULL";

        List<RepairCase> results = jdbcTemplate.query(sql, new RepairCaseRowMapper(), caseId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public long countOpenCases() {
        Long count = jdbcTemplate.queryForObject("""
            SELECT COUNT(*) FROM repair_cases
            WHERE status NOT IN ('completed', 'cancelled')
            AND deleted_at IS NULL
            """, Long.class);
        return count != null ? count : 0L;
    }

    /**
     * Store the latest computed compliance without touching updated_at,
     * which doubles as the first-response fallback
     */
    public int updateSlaStatus(UUID caseId, String slaStatus) {
        return jdbcTemplate.update(
                "UPDATE repair_cases SET sla_status = ? WHERE id = ?",
                slaStatus, caseId);
    }

    public int updateEscalationInfo(UUID caseId, String slaStatus, int escalationLevel) {
        String sql = """
            UPDATE repair_cases
            SET last_sla_check = NOW(),
                sla_status = ?,
                escalation_level = ?,
                updated_at = NOW()
            WHERE id = ?
            """;

        return jdbcTemplate.update(sql, slaStatus, escalationLevel, caseId);
    }

    private static class RepairCaseRowMapper implements RowMapper<RepairCase> {
        @Override
        public RepairCase mapRow(ResultSet rs, int rowNum) throws SQLException {
            return RepairCase.builder()
                    .id(rs.getObject("id", UUID.class))
                    .caseNumber(rs.getString("case_number"))
                    .status(rs.getString("status"))
                    .priority(rs.getString("priority"))
                    .serviceType(rs.getString("service_type"))
                    .customerId(rs.getObject("customer_id", UUID.class))
                    .customerTier(rs.getString("customer_tier"))
                    .deviceId(rs.getObject("device_id", UUID.class))
                    .slaId(rs.getObject("sla_id", UUID.class))
                    .assignedTechnicianId(rs.getObject("assigned_technician_id", UUID.class))
                    .assignedAt(toInstant(rs.getTimestamp("assigned_at")))
                    .completedAt(toInstant(rs.getTimestamp("actual_completion_date")))
                    .estimatedValue(rs.getBigDecimal("estimated_value"))
                    .slaStatus(rs.getString("sla_status"))
                    .escalationLevel(rs.getObject("escalation_level", Integer.class))
                    .lastSlaCheck(toInstant(rs.getTimestamp("last_sla_check")))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }

        private static Instant toInstant(Timestamp timestamp) {
            return timestamp != null ? timestamp.toInstant() : null;
        }
    }
}
