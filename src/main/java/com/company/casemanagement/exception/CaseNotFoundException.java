package com.company.casemanagement.exception;

import java.util.UUID;

public class CaseNotFoundException extends RuntimeException {
    public CaseNotFoundException(UUID caseId) {
        super("Repair case not found: " + caseId);
    }
}
