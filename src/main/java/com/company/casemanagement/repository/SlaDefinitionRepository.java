package com.company.casemanagement.repository;

import com.company.casemanagement.domain.EscalationRule;
import com.company.casemanagement.domain.PenaltyRule;
import com.company.casemanagement.domain.SlaDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
@Slf4j
public class SlaDefinitionRepository {

    private static final TypeReference<List<EscalationRule>> ESCALATION_RULES = new TypeReference<>() {
    };
    private static final TypeReference<List<PenaltyRule>> PENALTY_RULES = new TypeReference<>() {
    };

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String SELECT_BASE = """
        SELECT id, name, customer_tier, service_type, priority,
               response_time_hours, resolution_time_hours,
               escalation_rules::text AS escalation_rules,
               penalty_rules::text AS penalty_rules,
               is_active
        FROM sla_definitions
        """;

    public Optional<SlaDefinition> findActiveById(UUID slaId) {
        String sql = SELECT_BASE + " WHERE id = ? AND is_active = true";

        List<SlaDefinition> results = jdbcTemplate.query(sql, rowMapper(), slaId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Highest-priority active definition for a tier / service type pair
     */
    public Optional<SlaDefinition> findDefault(String customerTier, String serviceType) {
        String sql = SELECT_BASE + """
            WHERE customer_tier = ?
            AND service_type = ?
            AND is_active = true
            ORDER BY priority DESC
            LIMIT 1
            """;

        List<SlaDefinition> results = jdbcTemplate.query(sql, rowMapper(), customerTier, serviceType);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    public List<SlaDefinition> findAllActive() {
        return jdbcTemplate.query(SELECT_BASE + " WHERE is_active = true ORDER BY name", rowMapper());
    }

    private RowMapper<SlaDefinition> rowMapper() {
        return (ResultSet rs, int rowNum) -> SlaDefinition.builder()
                .id(rs.getObject("id", UUID.class))
                .name(rs.getString("name"))
                .customerTier(rs.getString("customer_tier"))
                .serviceType(rs.getString("service_type"))
                .priority(rs.getInt("priority"))
                .responseTimeHours(rs.getInt("response_time_hours"))
                .resolutionTimeHours(rs.getInt("resolution_time_hours"))
                .escalationRules(readRules(rs, "escalation_rules", ESCALATION_RULES))
                .penaltyRules(readRules(rs, "penalty_rules", PENALTY_RULES))
                .active(rs.getBoolean("is_active"))
                .build();
    }

    private <T> List<T> readRules(ResultSet rs, String column, TypeReference<List<T>> type) throws SQLException {
        String json = rs.getString(column);
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            List<T> rules = objectMapper.readValue(json, type);
            return rules != null ? rules : new ArrayList<>();
        } catch (JsonProcessingException e) {
            // A malformed rule set disables those rules for the definition, the SLA targets still apply
            log.warn("Ignoring malformed {} on SLA definition {}", column, rs.getString("id"), e);
            return new ArrayList<>();
        }
    }
}
