package com.company.casemanagement.migration;

import java.util.List;

/**
 * One versioned, reversible schema change. Versions start at 1 and leave no gaps.
 * Statements run in order inside a single transaction.
 */
public interface SchemaMigration {

    int version();

    String name();

    List<String> upStatements();

    /**
     * Must tolerate objects that are already gone (IF EXISTS)
     */
    List<String> downStatements();
}
