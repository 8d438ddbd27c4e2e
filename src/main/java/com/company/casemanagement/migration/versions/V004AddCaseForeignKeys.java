package com.company.casemanagement.migration.versions;

import com.company.casemanagement.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class V004AddCaseForeignKeys implements SchemaMigration {

    @Override
    public int version() {
        return 4;
    }

    @Override
    public String name() {
        return "Add foreign keys between case, customer, device and SLA tables";
    }

    @Override
    public List<String> upStatements() {
        return List.of(
                """
                ALTER TABLE devices
                    ADD CONSTRAINT fk_devices_customer
                    FOREIGN KEY (customer_id) REFERENCES customers(id)
                """,
                """
                ALTER TABLE repair_cases
                    ADD CONSTRAINT fk_repair_cases_customer
                    FOREIGN KEY (customer_id) REFERENCES customers(id)
                """,
                """
                ALTER TABLE repair_cases
                    ADD CONSTRAINT fk_repair_cases_device
                    FOREIGN KEY (device_id) REFERENCES devices(id)
                """,
                """
                ALTER TABLE repair_cases
                    ADD CONSTRAINT fk_repair_cases_sla
                    FOREIGN KEY (sla_id) REFERENCES sla_definitions(id) ON DELETE SET NULL
                """,
                """
                ALTER TABLE case_escalations
                    ADD CONSTRAINT fk_case_escalations_case
                    FOREIGN KEY (case_id) REFERENCES repair_cases(id) ON DELETE CASCADE
                """,
                """
                ALTER TABLE sla_compliance
                    ADD CONSTRAINT fk_sla_compliance_case
                    FOREIGN KEY (repair_case_id) REFERENCES repair_cases(id) ON DELETE CASCADE
                """
        );
    }

    // Tables may already be gone when an earlier version was rolled back first
    @Override
    public List<String> downStatements() {
        return List.of(
                "ALTER TABLE IF EXISTS sla_compliance DROP CONSTRAINT IF EXISTS fk_sla_compliance_case",
                "ALTER TABLE IF EXISTS case_escalations DROP CONSTRAINT IF EXISTS fk_case_escalations_case",
                "ALTER TABLE IF EXISTS repair_cases DROP CONSTRAINT IF EXISTS fk_repair_cases_sla",
                "ALTER TABLE IF EXISTS repair_cases DROP CONSTRAINT IF EXISTS fk_repair_cases_device",
                "ALTER TABLE IF EXISTS repair_cases DROP CONSTRAINT IF EXISTS fk_repair_cases_customer",
                "ALTER TABLE IF EXISTS devices DROP CONSTRAINT IF EXISTS fk_devices_customer"
        );
    }
}
