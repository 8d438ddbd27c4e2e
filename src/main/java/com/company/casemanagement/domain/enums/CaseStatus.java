package com.company.casemanagement.domain.enums;

public enum CaseStatus {
    CREATED("created"),
    OPEN("open"),
    ASSIGNED("assigned"),
    IN_PROGRESS("in_progress"),
    WAITING_PARTS("waiting_parts"),
    WAITING_CUSTOMER("waiting_customer"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String value;

    CaseStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * A case counts as responded to once it has left the intake states
     */
    public boolean isResponded() {
        return this != CREATED && this != OPEN;
    }

    public static CaseStatus fromString(String status) {
        if (status == null) {
            return OPEN;
        }
        for (CaseStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(status)) {
                return candidate;
            }
        }
        return OPEN;
    }
}
