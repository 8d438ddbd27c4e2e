package com.company.casemanagement.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlaMonitoringRunResponse {
    private SlaMonitoringSummary summary;
    private List<SlaMonitoringResult> results;
}
