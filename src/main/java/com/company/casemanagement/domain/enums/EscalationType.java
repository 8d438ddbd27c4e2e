package com.company.casemanagement.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EscalationType {
    WARNING("warning"),
    CRITICAL("critical"),
    BREACH("breach");

    private final String value;

    EscalationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Breached cases escalate as BREACH, everything else as WARNING
     */
    public static EscalationType forStatus(SlaComplianceStatus status) {
        return status == SlaComplianceStatus.BREACHED ? BREACH : WARNING;
    }

    @JsonCreator
    public static EscalationType fromString(String type) {
        if (type == null) {
            return WARNING;
        }
        for (EscalationType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(type)) {
                return candidate;
            }
        }
        return WARNING;
    }
}
