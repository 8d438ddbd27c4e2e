package com.company.casemanagement.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaDefinition {
    private UUID id;
    private String name;
    private String customerTier;
    private String serviceType;
    private Integer priority;
    private Integer responseTimeHours;
    private Integer resolutionTimeHours;

    @Builder.Default
    private List<EscalationRule> escalationRules = new ArrayList<>();

    @Builder.Default
    private List<PenaltyRule> penaltyRules = new ArrayList<>();

    private Boolean active;
}
