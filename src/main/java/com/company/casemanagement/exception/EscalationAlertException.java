package com.company.casemanagement.exception;

public class EscalationAlertException extends RuntimeException {
    public EscalationAlertException(String message, Throwable cause) {
        super(message, cause);
    }
}
