package com.company.casemanagement.migration;

import com.company.casemanagement.config.MigrationProperties;
import com.company.casemanagement.dto.response.MigrationStatusResponse;
import com.company.casemanagement.exception.MigrationException;
import com.company.casemanagement.exception.MigrationNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Applies {@link SchemaMigration}s in version order. Each version runs on its own
 * connection in its own transaction; the first failure stops the batch.
 */
@Component
@Slf4j
public class MigrationRunner {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final List<SchemaMigration> migrations;
    private final DataSource dataSource;
    private final String historyTable;

    public MigrationRunner(List<SchemaMigration> migrations, DataSource dataSource,
                           MigrationProperties properties) {
        this.migrations = validate(migrations);
        this.dataSource = dataSource;
        this.historyTable = properties.getHistoryTable();

        if (!TABLE_NAME.matcher(historyTable).matches()) {
            throw new IllegalStateException("Invalid migration history table name: " + historyTable);
        }
    }

    /**
     * Apply every pending migration in ascending order.
     *
     * @return the versions applied by this call
     */
    public List<Integer> migrate() {
        ensureHistoryTable();
        NavigableMap<Integer, Instant> applied = appliedVersions();

        int highestApplied = applied.isEmpty() ? 0 : applied.lastKey();

        List<SchemaMigration> pending = migrations.stream()
                .filter(m -> !applied.containsKey(m.version()))
                .toList();

        for (SchemaMigration migration : pending) {
            if (migration.version() < highestApplied) {
                throw new MigrationException(migration.version(),
                        "is pending but version " + highestApplied + " is already applied", null);
            }
        }

        if (pending.isEmpty()) {
            log.info("Schema is up to date at version {}", highestApplied);
            return List.of();
        }

        log.info("Applying {} pending migrations (current version {})", pending.size(), highestApplied);

        List<Integer> appliedNow = new ArrayList<>();
        for (SchemaMigration migration : pending) {
            log.info("Running migration {}: {}", migration.version(), migration.name());

            runInTransaction(migration, "failed", migration.upStatements(), connection -> {
                String sql = "INSERT INTO " + historyTable + " (version, name, applied_at) VALUES (?, ?, ?)";
                try (PreparedStatement insert = connection.prepareStatement(sql)) {
                    insert.setInt(1, migration.version());
                    insert.setString(2, migration.name());
                    insert.setTimestamp(3, Timestamp.from(Instant.now()));
                    insert.executeUpdate();
                }
            });

            appliedNow.add(migration.version());
            log.info("Migration {} completed: {}", migration.version(), migration.name());
        }

        return appliedNow;
    }

    /**
     * Run the down statements of {@code version} and forget it. Safe to repeat, but refused
     * while a higher version is still applied.
     */
    public void rollback(int version) {
        SchemaMigration migration = migrations.stream()
                .filter(m -> m.version() == version)
                .findFirst()
                .orElseThrow(() -> new MigrationNotFoundException(version));

        ensureHistoryTable();
        NavigableMap<Integer, Instant> applied = appliedVersions();

        if (applied.higherKey(version) != null) {
            throw new MigrationException(version,
                    "cannot be rolled back while version " + applied.lastKey() + " is applied", null);
        }

        rollBack(migration);
    }

    /**
     * @return the version rolled back, empty when nothing is applied
     */
    public Optional<Integer> rollbackLatest() {
        ensureHistoryTable();
        NavigableMap<Integer, Instant> applied = appliedVersions();

        if (applied.isEmpty()) {
            log.info("No applied migrations to roll back");
            return Optional.empty();
        }

        int latest = applied.lastKey();
        SchemaMigration migration = migrations.stream()
                .filter(m -> m.version() == latest)
                .findFirst()
                .orElseThrow(() -> new MigrationNotFoundException(latest));

        rollBack(migration);
        return Optional.of(latest);
    }

    /**
     * Registered migrations with their applied flag. Read-only: a missing history table
     * means nothing is applied.
     */
    public List<MigrationStatusResponse> status() {
        NavigableMap<Integer, Instant> applied = historyTableExists()
                ? appliedVersions()
                : new TreeMap<>();

        return migrations.stream()
                .map(m -> MigrationStatusResponse.builder()
                        .version(m.version())
                        .name(m.name())
                        .applied(applied.containsKey(m.version()))
                        .appliedAt(applied.get(m.version()))
                        .build())
                .toList();
    }

    private void rollBack(SchemaMigration migration) {
        log.info("Rolling back migration {}: {}", migration.version(), migration.name());

        runInTransaction(migration, "rollback failed", migration.downStatements(), connection -> {
            try (PreparedStatement delete = connection.prepareStatement(
                    "DELETE FROM " + historyTable + " WHERE version = ?")) {
                delete.setInt(1, migration.version());
                delete.executeUpdate();
            }
        });

        log.info("Migration {} rolled back: {}", migration.version(), migration.name());
    }

    private void runInTransaction(SchemaMigration migration, String failureMessage,
                                  List<String> statements, HistoryUpdate historyUpdate) {
        try (Connection connection = dataSource.getConnection()) {
            connection.setAutoCommit(false);
            try {
                try (Statement statement = connection.createStatement()) {
                    for (String sql : statements) {
                        statement.execute(sql);
                    }
                }
                historyUpdate.apply(connection);
                connection.commit();
            } catch (SQLException | RuntimeException e) {
                rollbackTransaction(connection, migration, e);
                throw new MigrationException(migration.version(), failureMessage + ": " + e.getMessage(), e);
            }
        } catch (SQLException e) {
            throw new MigrationException(migration.version(), "connection error: " + e.getMessage(), e);
        }
    }

    private void rollbackTransaction(Connection connection, SchemaMigration migration, Exception cause) {
        try {
            connection.rollback();
            log.warn("Transaction for migration {} rolled back", migration.version());
        } catch (SQLException rollbackError) {
            log.error("Rollback of migration {} failed", migration.version(), rollbackError);
            cause.addSuppressed(rollbackError);
        }
    }

    private void ensureHistoryTable() {
        String sql = """
            CREATE TABLE IF NOT EXISTS %s (
                version INTEGER PRIMARY KEY,
                name VARCHAR(255) NOT NULL,
                applied_at TIMESTAMP NOT NULL DEFAULT NOW()
            )
            """.formatted(historyTable);

        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(sql);
        } catch (SQLException e) {
            throw new MigrationException("Cannot create migration history table " + historyTable, e);
        }
    }

    private boolean historyTableExists() {
        try (Connection connection = dataSource.getConnection();
             ResultSet tables = connection.getMetaData().getTables(
                     null, null, historyTable.toLowerCase(Locale.ROOT), new String[]{"TABLE"})) {
            return tables.next();
        } catch (SQLException e) {
            throw new MigrationException("Cannot look up migration history table " + historyTable, e);
        }
    }

    private NavigableMap<Integer, Instant> appliedVersions() {
        NavigableMap<Integer, Instant> applied = new TreeMap<>();

        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement();
             ResultSet rs = statement.executeQuery(
                     "SELECT version, applied_at FROM " + historyTable + " ORDER BY version")) {
            while (rs.next()) {
                Timestamp appliedAt = rs.getTimestamp("applied_at");
                applied.put(rs.getInt("version"), appliedAt != null ? appliedAt.toInstant() : null);
            }
        } catch (SQLException e) {
            throw new MigrationException("Cannot read migration history from " + historyTable, e);
        }

        int known = migrations.size();
        applied.keySet().stream()
                .filter(v -> v > known)
                .forEach(v -> log.warn("Applied migration {} is not known to this build", v));

        return applied;
    }

    private static List<SchemaMigration> validate(List<SchemaMigration> migrations) {
        List<SchemaMigration> sorted = migrations.stream()
                .sorted(Comparator.comparingInt(SchemaMigration::version))
                .toList();

        for (int i = 0; i < sorted.size(); i++) {
            int expected = i + 1;
            int actual = sorted.get(i).version();
            if (actual != expected) {
                if (i > 0 && actual == sorted.get(i - 1).version()) {
                    throw new IllegalStateException("Duplicate migration version " + actual);
                }
                throw new IllegalStateException(
                        "Migration versions must be gapless from 1: expected " + expected + " but found " + actual);
            }
        }

        return sorted;
    }

    @FunctionalInterface
    private interface HistoryUpdate {
        void apply(Connection connection) throws SQLException;
    }
}
