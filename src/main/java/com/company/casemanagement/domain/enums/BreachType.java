package com.company.casemanagement.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum BreachType {
    RESPONSE("response", "First response came later than the SLA target"),
    RESOLUTION("resolution", "Resolution came later than the SLA target");

    private final String value;
    private final String description;

    BreachType(String value, String description) {
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

    @JsonCreator
    public static BreachType fromString(String type) {
        if (type == null) {
            return RESOLUTION;
        }
        for (BreachType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(type)) {
                return candidate;
            }
        }
        return RESOLUTION;
    }
}
