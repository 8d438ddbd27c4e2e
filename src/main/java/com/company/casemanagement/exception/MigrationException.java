package com.company.casemanagement.exception;

/**
 * A migration step failed. Schema changes of the failing version are rolled back.
 */
public class MigrationException extends RuntimeException {

    private final int version;

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
        this.version = 0;
    }

    public MigrationException(int version, String message, Throwable cause) {
        super("Migration " + version + " " + message, cause);
        this.version = version;
    }

    /**
     * @return the failing version, 0 when the failure was in the history bookkeeping
     */
    public int getVersion() {
        return version;
    }
}
