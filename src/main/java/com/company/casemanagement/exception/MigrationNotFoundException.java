package com.company.casemanagement.exception;

public class MigrationNotFoundException extends RuntimeException {
    public MigrationNotFoundException(int version) {
        super("Migration not found: " + version);
    }
}
