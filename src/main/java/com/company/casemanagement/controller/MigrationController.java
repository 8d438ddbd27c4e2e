package com.company.casemanagement.controller;

import com.company.casemanagement.dto.response.MigrationStatusResponse;
import com.company.casemanagement.migration.MigrationRunner;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/migrations")
@RequiredArgsConstructor
@Tag(name = "Migrations", description = "Schema migration status")
public class MigrationController {

    private final MigrationRunner migrationRunner;

    @GetMapping
    @Operation(summary = "List registered migrations and whether each is applied")
    public ResponseEntity<List<MigrationStatusResponse>> getStatus() {
        return ResponseEntity.ok(migrationRunner.status());
    }
}
