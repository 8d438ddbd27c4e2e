package com.company.casemanagement.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "casemanagement.migration")
public class MigrationProperties {

    private boolean runOnStartup = true;

    @NotBlank
    private String historyTable = "schema_migrations";
}
