package com.company.casemanagement.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaseEscalation {
    private UUID id;
    private UUID caseId;
    private Integer escalationLevel;
    private String escalationType;
    private String reason;
    private String slaStatus; // JSON snapshot of the evaluation
    private String escalatedBy;
    private Instant notifiedAt;
    private Instant createdAt;
}
