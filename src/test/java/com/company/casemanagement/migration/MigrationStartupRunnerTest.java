package com.company.casemanagement.migration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MigrationStartupRunnerTest {

    private MigrationRunner migrationRunner;
    private MigrationStartupRunner startupRunner;

    @BeforeEach
    void setUp() {
        migrationRunner = Mockito.mock(MigrationRunner.class);
        startupRunner = new MigrationStartupRunner(migrationRunner);
        when(migrationRunner.migrate()).thenReturn(List.of(1, 2));
    }

    @Test
    void migratesByDefault() {
        startupRunner.run(new DefaultApplicationArguments());

        verify(migrationRunner).migrate();
        verify(migrationRunner, never()).rollback(anyInt());
    }

    @Test
    void rollsBackRequestedVersionInsteadOfMigrating() {
        startupRunner.run(new DefaultApplicationArguments("--rollback-migration=3"));

        verify(migrationRunner).rollback(3);
        verify(migrationRunner, never()).migrate();
    }

    @Test
    void rollsBackLatestVersion() {
        when(migrationRunner.rollbackLatest()).thenReturn(Optional.of(4));

        startupRunner.run(new DefaultApplicationArguments("--rollback-migration=latest"));

        verify(migrationRunner).rollbackLatest();
        verify(migrationRunner, never()).migrate();
    }

    @Test
    void rejectsMalformedRollbackTarget() {
        assertThatThrownBy(() -> startupRunner.run(new DefaultApplicationArguments("--rollback-migration=abc")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("abc");
    }
}
