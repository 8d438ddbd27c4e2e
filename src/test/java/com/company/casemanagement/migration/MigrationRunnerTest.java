package com.company.casemanagement.migration;

import com.company.casemanagement.config.MigrationProperties;
import com.company.casemanagement.dto.response.MigrationStatusResponse;
import com.company.casemanagement.exception.MigrationException;
import com.company.casemanagement.exception.MigrationNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MigrationRunnerTest {

    private DataSource dataSource;
    private Connection bookkeeping;
    private Statement bookkeepingStatement;
    private ResultSet history;
    private ResultSet historyTables;

    @BeforeEach
    void setUp() throws SQLException {
        dataSource = Mockito.mock(DataSource.class);
        bookkeeping = Mockito.mock(Connection.class);
        bookkeepingStatement = Mockito.mock(Statement.class);
        history = Mockito.mock(ResultSet.class);
        historyTables = Mockito.mock(ResultSet.class);
        DatabaseMetaData metaData = Mockito.mock(DatabaseMetaData.class);

        when(bookkeeping.createStatement()).thenReturn(bookkeepingStatement);
        when(bookkeepingStatement.executeQuery(anyString())).thenReturn(history);
        when(history.next()).thenReturn(false);
        when(bookkeeping.getMetaData()).thenReturn(metaData);
        when(metaData.getTables(isNull(), isNull(), eq("schema_migrations"), any())).thenReturn(historyTables);
        when(historyTables.next()).thenReturn(true);
    }

    @Test
    void thirdOfFourStatementsFailingRollsBackTheWholeVersionAndStopsTheBatch() throws SQLException {
        Connection connection = Mockito.mock(Connection.class);
        Statement statement = Mockito.mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.execute("CREATE TABLE c")).thenThrow(new SQLException("syntax error"));
        when(dataSource.getConnection()).thenReturn(bookkeeping, bookkeeping, connection);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a", "CREATE TABLE b", "CREATE TABLE c",
                        "CREATE INDEX a_idx ON a (id)")),
                migration(2, List.of("CREATE TABLE d")));

        assertThatThrownBy(runner::migrate)
                .isInstanceOfSatisfying(MigrationException.class, e -> assertThat(e.getVersion()).isEqualTo(1))
                .hasRootCauseInstanceOf(SQLException.class);

        InOrder order = inOrder(connection, statement);
        order.verify(connection).setAutoCommit(false);
        order.verify(statement).execute("CREATE TABLE a");
        order.verify(statement).execute("CREATE TABLE b");
        order.verify(statement).execute("CREATE TABLE c");
        order.verify(connection).rollback();
        order.verify(connection).close();

        verify(connection, never()).commit();
        verify(connection, never()).prepareStatement(anyString());
        verify(connection, times(1)).close();
        verify(statement, never()).execute("CREATE INDEX a_idx ON a (id)");
        verify(statement, never()).execute("CREATE TABLE d");
        verify(dataSource, times(3)).getConnection();
    }

    @Test
    void pendingMigrationsAreAppliedInOrderEachInItsOwnTransaction() throws SQLException {
        Connection first = migrationConnection();
        Connection second = migrationConnection();
        when(dataSource.getConnection()).thenReturn(bookkeeping, bookkeeping, first, second);

        MigrationRunner runner = runner(
                migration(2, List.of("CREATE TABLE b")),
                migration(1, List.of("CREATE TABLE a")));

        assertThat(runner.migrate()).containsExactly(1, 2);

        verify(first.createStatement()).execute("CREATE TABLE a");
        verify(second.createStatement()).execute("CREATE TABLE b");
        verify(first).commit();
        verify(second).commit();
        verify(first).close();
        verify(second).close();
        verify(first).prepareStatement(contains("INSERT INTO schema_migrations"));
    }

    @Test
    void appliedVersionsAreSkipped() throws SQLException {
        appliedHistory(1);
        Connection second = migrationConnection();
        when(dataSource.getConnection()).thenReturn(bookkeeping, bookkeeping, second);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a")),
                migration(2, List.of("CREATE TABLE b")));

        assertThat(runner.migrate()).containsExactly(2);
        verify(second.createStatement(), never()).execute("CREATE TABLE a");
    }

    @Test
    void pendingVersionBelowAppliedOneIsRefused() throws SQLException {
        appliedHistory(2);
        when(dataSource.getConnection()).thenReturn(bookkeeping);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a")),
                migration(2, List.of("CREATE TABLE b")),
                migration(3, List.of("CREATE TABLE c")));

        assertThatThrownBy(runner::migrate)
                .isInstanceOf(MigrationException.class)
                .hasMessageContaining("Migration 1");
        verify(dataSource, times(2)).getConnection();
    }

    @Test
    void registryWithGapIsRejected() {
        assertThatThrownBy(() -> runner(migration(1, List.of()), migration(3, List.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expected 2");
    }

    @Test
    void registryWithDuplicateVersionIsRejected() {
        assertThatThrownBy(() -> runner(migration(1, List.of()), migration(1, List.of())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void registryMustStartAtOne() {
        assertThatThrownBy(() -> runner(migration(2, List.of())))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rollbackOfUnknownVersionFails() {
        MigrationRunner runner = runner(migration(1, List.of("CREATE TABLE a")));

        assertThatThrownBy(() -> runner.rollback(7)).isInstanceOf(MigrationNotFoundException.class);
    }

    @Test
    void rollbackRunsDownStatementsAndForgetsTheVersion() throws SQLException {
        Connection connection = migrationConnection();
        when(dataSource.getConnection()).thenReturn(bookkeeping, bookkeeping, connection);

        MigrationRunner runner = runner(migration(1, List.of("CREATE TABLE a")));
        runner.rollback(1);

        verify(connection.createStatement()).execute("DROP TABLE IF EXISTS t1");
        verify(connection).prepareStatement(contains("DELETE FROM schema_migrations"));
        verify(connection).commit();
        verify(connection, times(1)).close();
    }

    @Test
    void repeatedRollbackSucceeds() throws SQLException {
        Connection first = migrationConnection();
        Connection second = migrationConnection();
        when(dataSource.getConnection()).thenReturn(bookkeeping, bookkeeping, first, bookkeeping, bookkeeping, second);

        MigrationRunner runner = runner(migration(1, List.of("CREATE TABLE a")));
        runner.rollback(1);
        runner.rollback(1);

        verify(first).commit();
        verify(second).commit();
    }

    @Test
    void rollbackBelowTheHighestAppliedVersionIsRefused() throws SQLException {
        appliedHistory(1, 2, 3);
        when(dataSource.getConnection()).thenReturn(bookkeeping);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a")),
                migration(2, List.of("CREATE TABLE b")),
                migration(3, List.of("CREATE TABLE c")));

        assertThatThrownBy(() -> runner.rollback(2))
                .isInstanceOfSatisfying(MigrationException.class, e -> assertThat(e.getVersion()).isEqualTo(2))
                .hasMessageContaining("version 3 is applied");

        verify(bookkeeping, never()).setAutoCommit(false);
        verify(bookkeepingStatement, never()).execute("DROP TABLE IF EXISTS t2");
        verify(dataSource, times(2)).getConnection();
    }

    @Test
    void rollbackOfTheHighestAppliedVersionIsAllowed() throws SQLException {
        appliedHistory(1, 2);
        Connection connection = migrationConnection();
        when(dataSource.getConnection()).thenReturn(bookkeeping, bookkeeping, connection);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a")),
                migration(2, List.of("CREATE TABLE b")));
        runner.rollback(2);

        verify(connection.createStatement()).execute("DROP TABLE IF EXISTS t2");
        verify(connection).commit();
    }

    @Test
    void rollbackLatestWithNothingAppliedIsANoOp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(bookkeeping);

        MigrationRunner runner = runner(migration(1, List.of("CREATE TABLE a")));

        assertThat(runner.rollbackLatest()).isEmpty();
        verify(bookkeeping, never()).setAutoCommit(false);
    }

    @Test
    void rollbackLatestTargetsHighestAppliedVersion() throws SQLException {
        appliedHistory(1, 2);
        Connection connection = migrationConnection();
        when(dataSource.getConnection()).thenReturn(bookkeeping, bookkeeping, connection);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a")),
                migration(2, List.of("CREATE TABLE b")));

        assertThat(runner.rollbackLatest()).contains(2);
        verify(connection.createStatement()).execute("DROP TABLE IF EXISTS t2");
    }

    @Test
    void statusListsEveryRegisteredMigration() throws SQLException {
        appliedHistory(1);
        when(dataSource.getConnection()).thenReturn(bookkeeping);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a")),
                migration(2, List.of("CREATE TABLE b")));

        List<MigrationStatusResponse> status = runner.status();

        assertThat(status).extracting(MigrationStatusResponse::getVersion).containsExactly(1, 2);
        assertThat(status).extracting(MigrationStatusResponse::isApplied).containsExactly(true, false);
        assertThat(status.get(0).getAppliedAt()).isNotNull();
        assertThat(status.get(1).getAppliedAt()).isNull();
        verify(bookkeepingStatement, never()).execute(contains("CREATE TABLE"));
    }

    @Test
    void statusWithoutHistoryTableReportsNothingAppliedAndCreatesNothing() throws SQLException {
        when(historyTables.next()).thenReturn(false);
        when(dataSource.getConnection()).thenReturn(bookkeeping);

        MigrationRunner runner = runner(
                migration(1, List.of("CREATE TABLE a")),
                migration(2, List.of("CREATE TABLE b")));

        assertThat(runner.status()).extracting(MigrationStatusResponse::isApplied).containsExactly(false, false);
        verify(bookkeeping, never()).createStatement();
        verify(dataSource, times(1)).getConnection();
    }

    @Test
    void invalidHistoryTableNameIsRejected() {
        MigrationProperties properties = new MigrationProperties();
        properties.setHistoryTable("schema_migrations; DROP TABLE x");

        assertThatThrownBy(() -> new MigrationRunner(List.of(migration(1, List.of())), dataSource, properties))
                .isInstanceOf(IllegalStateException.class);
    }

    private MigrationRunner runner(SchemaMigration... migrations) {
        return new MigrationRunner(List.of(migrations), dataSource, new MigrationProperties());
    }

    private void appliedHistory(Integer... versions) throws SQLException {
        Boolean[] more = new Boolean[versions.length];
        for (int i = 0; i < versions.length; i++) {
            more[i] = i < versions.length - 1;
        }
        // next() is true once per row, then false
        when(history.next()).thenReturn(true, more);
        when(history.getInt("version")).thenReturn(versions[0], Arrays.copyOfRange(versions, 1, versions.length));
        when(history.getTimestamp("applied_at")).thenReturn(Timestamp.from(Instant.parse("2026-01-10T09:00:00Z")));
    }

    private static Connection migrationConnection() throws SQLException {
        Connection connection = Mockito.mock(Connection.class);
        Statement statement = Mockito.mock(Statement.class);
        PreparedStatement preparedStatement = Mockito.mock(PreparedStatement.class);
        when(connection.createStatement()).thenReturn(statement);
        when(connection.prepareStatement(anyString())).thenReturn(preparedStatement);
        return connection;
    }

    private static SchemaMigration migration(int version, List<String> up) {
        return new SchemaMigration() {
            @Override
            public int version() {
                return version;
            }

            @Override
            public String name() {
                return "migration " + version;
            }

            @Override
            public List<String> upStatements() {
                return up;
            }

            @Override
            public List<String> downStatements() {
                return List.of("DROP TABLE IF EXISTS t" + version);
            }
        };
    }
}
