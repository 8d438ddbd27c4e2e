package com.company.casemanagement.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaMetrics {
    private UUID id;
    private UUID slaId;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private Integer totalCases;
    private Integer metCases;
    private Integer breachedCases;
    private BigDecimal complianceRate;
    private BigDecimal avgResponseTimeHours;
    private BigDecimal avgResolutionTimeHours;
    private Instant createdAt;
}
