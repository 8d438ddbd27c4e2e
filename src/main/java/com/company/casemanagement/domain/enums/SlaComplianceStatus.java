package com.company.casemanagement.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SlaComplianceStatus {
    ON_TRACK("on_track", "Case is within its SLA targets"),
    AT_RISK("at_risk", "Case is approaching an SLA target"),
    BREACHED("breached", "Case has exceeded an SLA target");

    private final String value;
    private final String description;

    SlaComplianceStatus(String value, String description) {
        this.value = value;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public static SlaComplianceStatus fromString(String status) {
        if (status == null) {
            return ON_TRACK;
        }
        for (SlaComplianceStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(status) || candidate.name().equalsIgnoreCase(status)) {
                return candidate;
            }
        }
        return ON_TRACK;
    }
}
