package com.company.casemanagement.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

/**
 * SLA monitoring switches, bound from {@code casemanagement.sla.*}
 */
@Data
@Validated
@ConfigurationProperties(prefix = "casemanagement.sla")
public class SlaMonitoringProperties {

    private boolean enableSlaMonitoring = false;

    @Min(1)
    private int checkIntervalMinutes = 15;

    private boolean escalationEnabled = false;

    private boolean penaltyCalculationEnabled = false;

    // Fraction of a target that may elapse before a case counts as at risk
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double atRiskThreshold = 0.8;

    @NotBlank
    private String defaultCustomerTier = "standard";

    @NotBlank
    private String defaultServiceType = "repair";

    @NotNull
    private BigDecimal defaultCaseValue = BigDecimal.valueOf(1000);
}
