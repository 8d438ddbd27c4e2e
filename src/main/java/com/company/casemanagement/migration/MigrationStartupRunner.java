package com.company.casemanagement.migration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Brings the schema up to date before the application reports ready.
 * {@code --rollback-migration=<version|latest>} rolls back instead.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(
        value = "casemanagement.migration.run-on-startup",
        havingValue = "true",
        matchIfMissing = true
)
public class MigrationStartupRunner implements ApplicationRunner {

    static final String ROLLBACK_OPTION = "rollback-migration";

    private final MigrationRunner migrationRunner;

    @Override
    public void run(ApplicationArguments args) {
        if (args.containsOption(ROLLBACK_OPTION)) {
            rollback(args.getOptionValues(ROLLBACK_OPTION));
            return;
        }

        List<Integer> applied = migrationRunner.migrate();
        log.info("Startup migrations finished: {} applied", applied.size());
    }

    private void rollback(List<String> values) {
        String target = values == null || values.isEmpty() ? "" : values.get(0).trim();

        if ("latest".equalsIgnoreCase(target)) {
            Optional<Integer> rolledBack = migrationRunner.rollbackLatest();
            log.warn("Rollback requested at startup, rolled back: {}", rolledBack.map(String::valueOf).orElse("nothing"));
            return;
        }

        int version;
        try {
            version = Integer.parseInt(target);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "--" + ROLLBACK_OPTION + " expects a version number or 'latest', got '" + target + "'", e);
        }

        migrationRunner.rollback(version);
        log.warn("Rollback requested at startup, rolled back migration {}", version);
    }
}
