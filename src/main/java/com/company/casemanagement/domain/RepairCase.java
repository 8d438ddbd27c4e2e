package com.company.casemanagement.domain;

import com.company.casemanagement.domain.enums.CaseStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Repair case as seen by SLA monitoring (case row joined with the customer's tier)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepairCase {

    private UUID id;
    private String caseNumber;

    private String status; // created, open, assigned, in_progress, ..., completed, cancelled
    private String priority;
    private String serviceType;

    private UUID customerId;
    private String customerTier;
    private UUID deviceId;

    // Optional explicit SLA; falls back to tier/service-type defaults when null
    private UUID slaId;

    private UUID assignedTechnicianId;
    private Instant assignedAt;
    private Instant completedAt;
    private BigDecimal estimatedValue;

    // SLA bookkeeping written by the monitor
    private String slaStatus;
    private Integer escalationLevel;
    private Instant lastSlaCheck;

    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasResponded() {
        return CaseStatus.fromString(status).isResponded();
    }

    public boolean isCompleted() {
        return CaseStatus.fromString(status) == CaseStatus.COMPLETED;
    }
}
