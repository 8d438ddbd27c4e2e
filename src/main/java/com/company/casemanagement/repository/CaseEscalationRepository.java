package com.company.casemanagement.repository;

import com.company.casemanagement.domain.CaseEscalation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class CaseEscalationRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Highest level reached by the most recent escalation, 0 when the case was never escalated
     */
    public int findLastEscalationLevel(UUID caseId) {
        String sql = """
            SELECT escalation_level FROM case_escalations
            WHERE case_id = ?
            ORDER BY created_at DESC
            LIMIT 1
            """;

        List<Integer> levels = jdbcTemplate.queryForList(sql, Integer.class, caseId);
        return levels.isEmpty() || levels.get(0) == null ? 0 : levels.get(0);
    }

    public CaseEscalation save(CaseEscalation escalation) {
        if (escalation.getCreatedAt() == null) {
            escalation.setCreatedAt(Instant.now());
        }
        if (escalation.getEscalatedBy() == null) {
            escalation.setEscalatedBy("system");
        }

        String sql = """
            INSERT INTO case_escalations (
                case_id, escalation_level, escalation_type, reason,
                sla_status, escalated_by, created_at
            ) VALUES (?, ?, ?, ?, CAST(? AS JSONB), ?, ?)
            RETURNING id
            """;

        UUID id = jdbcTemplate.queryForObject(sql, UUID.class,
                escalation.getCaseId(),
                escalation.getEscalationLevel(),
                escalation.getEscalationType(),
                escalation.getReason(),
                escalation.getSlaStatus(),
                escalation.getEscalatedBy(),
                Timestamp.from(escalation.getCreatedAt())
        );

        escalation.setId(id);
        return escalation;
    }

    public int markNotified(UUID escalationId, Instant notifiedAt) {
        return jdbcTemplate.update(
                "UPDATE case_escalations SET notified_at = ? WHERE id = ?",
                Timestamp.from(notifiedAt), escalationId);
    }
}
