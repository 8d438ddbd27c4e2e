package com.company.casemanagement.controller;

import com.company.casemanagement.dto.response.MigrationStatusResponse;
import com.company.casemanagement.exception.MigrationException;
import com.company.casemanagement.migration.MigrationRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({MigrationController.class, HealthController.class})
class MigrationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MigrationRunner migrationRunner;

    @Test
    void listsMigrationStatus() throws Exception {
        when(migrationRunner.status()).thenReturn(List.of(
                new MigrationStatusResponse(1, "Create customer and device tables", true,
                        Instant.parse("2026-01-10T09:00:00Z")),
                new MigrationStatusResponse(2, "Create SLA definition and metrics tables", false, null)));

        mockMvc.perform(get("/api/v1/admin/migrations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].version").value(1))
                .andExpect(jsonPath("$[0].applied").value(true))
                .andExpect(jsonPath("$[1].applied").value(false));
    }

    @Test
    void healthReportsSchemaVersion() throws Exception {
        when(migrationRunner.status()).thenReturn(List.of(
                new MigrationStatusResponse(1, "Create customer and device tables", true,
                        Instant.parse("2026-01-10T09:00:00Z")),
                new MigrationStatusResponse(2, "Create SLA definition and metrics tables", true,
                        Instant.parse("2026-01-10T09:00:01Z")),
                new MigrationStatusResponse(3, "Create case tables", false, null)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("case-management-service"))
                .andExpect(jsonPath("$.schemaVersion").value(2))
                .andExpect(jsonPath("$.pendingMigrations").value(1));
    }

    @Test
    void healthStaysUpWhenHistoryIsUnreadable() throws Exception {
        when(migrationRunner.status()).thenThrow(
                new MigrationException("Cannot read migration history from schema_migrations",
                        new SQLException("connection refused")));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.schemaVersion").value("unknown"));
    }
}
