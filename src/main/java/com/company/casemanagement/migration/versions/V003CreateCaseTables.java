package com.company.casemanagement.migration.versions;

import com.company.casemanagement.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Repair cases and the tables SLA monitoring writes to. Foreign keys follow in version 4.
 */
@Component
public class V003CreateCaseTables implements SchemaMigration {

    @Override
    public int version() {
        return 3;
    }

    @Override
    public String name() {
        return "Create repair case, escalation and compliance tables";
    }

    @Override
    public List<String> upStatements() {
        return List.of(
                """
                CREATE TABLE repair_cases (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    case_number VARCHAR(50) UNIQUE NOT NULL,
                    customer_id UUID,
                    device_id UUID,
                    service_type VARCHAR(50) NOT NULL,
                    status VARCHAR(50) NOT NULL DEFAULT 'created',
                    priority VARCHAR(20) DEFAULT 'medium',
                    description TEXT,
                    assigned_technician_id UUID,
                    assigned_at TIMESTAMP,
                    sla_id UUID,
                    estimated_value DECIMAL(12,2),
                    estimated_completion_date TIMESTAMP,
                    actual_completion_date TIMESTAMP,
                    sla_status VARCHAR(20) DEFAULT 'on_track',
                    escalation_level INTEGER DEFAULT 0,
                    last_sla_check TIMESTAMP,
                    created_at TIMESTAMP DEFAULT NOW(),
                    updated_at TIMESTAMP DEFAULT NOW(),
                    deleted_at TIMESTAMP
                )
                """,
                """
                CREATE TABLE case_escalations (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    case_id UUID NOT NULL,
                    escalation_level INTEGER NOT NULL,
                    escalation_type VARCHAR(20) NOT NULL,
                    reason TEXT,
                    sla_status JSONB,
                    escalated_by VARCHAR(100) DEFAULT 'system',
                    notified_at TIMESTAMP,
                    created_at TIMESTAMP DEFAULT NOW()
                )
                """,
                """
                CREATE TABLE sla_compliance (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    repair_case_id UUID,
                    sla_id UUID NOT NULL,
                    target_response_time INTEGER,
                    actual_response_time INTEGER,
                    target_resolution_time INTEGER,
                    actual_resolution_time INTEGER,
                    status VARCHAR(20) NOT NULL,
                    breach_reason TEXT,
                    penalty_amount DECIMAL(10,2),
                    created_at TIMESTAMP DEFAULT NOW(),
                    updated_at TIMESTAMP DEFAULT NOW()
                )
                """,
                "CREATE INDEX idx_repair_cases_customer_id ON repair_cases(customer_id)",
                "CREATE INDEX idx_repair_cases_status ON repair_cases(status)",
                "CREATE INDEX idx_repair_cases_sla_check ON repair_cases(status, last_sla_check)",
                "CREATE INDEX idx_repair_cases_created_at ON repair_cases(created_at)",
                "CREATE INDEX idx_case_escalations_case_id ON case_escalations(case_id, created_at)",
                "CREATE INDEX idx_sla_compliance_case_id ON sla_compliance(repair_case_id)"
        );
    }

    @Override
    public List<String> downStatements() {
        return List.of(
                "DROP TABLE IF EXISTS sla_compliance CASCADE",
                "DROP TABLE IF EXISTS case_escalations CASCADE",
                "DROP TABLE IF EXISTS repair_cases CASCADE"
        );
    }
}
