package com.company.casemanagement.migration.versions;

import com.company.casemanagement.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class V002CreateSlaTables implements SchemaMigration {

    @Override
    public int version() {
        return 2;
    }

    @Override
    public String name() {
        return "Create SLA definition and metrics tables";
    }

    @Override
    public List<String> upStatements() {
        return List.of(
                """
                CREATE TABLE sla_definitions (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    name VARCHAR(255) NOT NULL,
                    description TEXT,
                    customer_tier VARCHAR(20) NOT NULL,
                    service_type VARCHAR(50) NOT NULL,
                    priority INTEGER NOT NULL DEFAULT 0,
                    response_time_hours INTEGER NOT NULL,
                    resolution_time_hours INTEGER NOT NULL,
                    escalation_rules JSONB NOT NULL DEFAULT '[]',
                    penalty_rules JSONB NOT NULL DEFAULT '[]',
                    is_active BOOLEAN NOT NULL DEFAULT true,
                    created_at TIMESTAMP DEFAULT NOW(),
                    updated_at TIMESTAMP DEFAULT NOW()
                )
                """,
                """
                CREATE TABLE sla_metrics (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    sla_id UUID NOT NULL REFERENCES sla_definitions(id) ON DELETE CASCADE,
                    period_start DATE NOT NULL,
                    period_end DATE NOT NULL,
                    total_cases INTEGER DEFAULT 0,
                    met_cases INTEGER DEFAULT 0,
                    breached_cases INTEGER DEFAULT 0,
                    compliance_rate DECIMAL(5,2) DEFAULT 0,
                    avg_response_time_hours DECIMAL(8,2),
                    avg_resolution_time_hours DECIMAL(8,2),
                    created_at TIMESTAMP DEFAULT NOW(),
                    UNIQUE (sla_id, period_start, period_end)
                )
                """,
                "CREATE INDEX idx_sla_definitions_lookup ON sla_definitions(customer_tier, service_type, is_active)",
                "CREATE INDEX idx_sla_definitions_priority ON sla_definitions(priority)",
                "CREATE INDEX idx_sla_metrics_period ON sla_metrics(period_start, period_end)"
        );
    }

    @Override
    public List<String> downStatements() {
        return List.of(
                "DROP TABLE IF EXISTS sla_metrics CASCADE",
                "DROP TABLE IF EXISTS sla_definitions CASCADE"
        );
    }
}
