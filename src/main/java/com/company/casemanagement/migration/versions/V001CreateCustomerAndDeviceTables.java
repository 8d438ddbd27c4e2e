package com.company.casemanagement.migration.versions;

import com.company.casemanagement.migration.SchemaMigration;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class V001CreateCustomerAndDeviceTables implements SchemaMigration {

    @Override
    public int version() {
        return 1;
    }

    @Override
    public String name() {
        return "Create customer and device tables";
    }

    @Override
    public List<String> upStatements() {
        return List.of(
                "CREATE EXTENSION IF NOT EXISTS pgcrypto",
                """
                CREATE TABLE customers (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    customer_code VARCHAR(50) UNIQUE NOT NULL,
                    customer_type VARCHAR(20) NOT NULL,
                    company_name VARCHAR(255),
                    contact_info JSONB NOT NULL DEFAULT '{}',
                    address_info JSONB NOT NULL DEFAULT '{}',
                    customer_tier VARCHAR(20) NOT NULL DEFAULT 'standard',
                    status VARCHAR(20) DEFAULT 'active',
                    created_at TIMESTAMP DEFAULT NOW(),
                    updated_at TIMESTAMP DEFAULT NOW(),
                    deleted_at TIMESTAMP
                )
                """,
                """
                CREATE TABLE devices (
                    id UUID PRIMARY KEY DEFAULT gen_random_uuid(),
                    device_code VARCHAR(50) UNIQUE NOT NULL,
                    customer_id UUID,
                    manufacturer VARCHAR(100),
                    model VARCHAR(100),
                    serial_number VARCHAR(100),
                    status VARCHAR(50) DEFAULT 'active',
                    warranty_info JSONB DEFAULT '{}',
                    created_at TIMESTAMP DEFAULT NOW(),
                    updated_at TIMESTAMP DEFAULT NOW(),
                    deleted_at TIMESTAMP
                )
                """,
                "CREATE INDEX idx_customers_tier ON customers(customer_tier)",
                "CREATE INDEX idx_customers_status ON customers(status)",
                "CREATE INDEX idx_devices_customer_id ON devices(customer_id)",
                "CREATE INDEX idx_devices_serial_number ON devices(serial_number)"
        );
    }

    // pgcrypto stays installed, other schemas may use it
    @Override
    public List<String> downStatements() {
        return List.of(
                "DROP TABLE IF EXISTS devices CASCADE",
                "DROP TABLE IF EXISTS customers CASCADE"
        );
    }
}
