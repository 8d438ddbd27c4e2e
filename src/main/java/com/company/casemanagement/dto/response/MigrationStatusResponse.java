package com.company.casemanagement.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MigrationStatusResponse {
    private int version;
    private String name;
    private boolean applied;
    private Instant appliedAt;
}
