package com.company.casemanagement.config;

import com.company.casemanagement.repository.RepairCaseRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-specific metrics
 */
@Configuration
@Slf4j
@RequiredArgsConstructor
public class MetricsConfiguration {

    private final RepairCaseRepository repairCaseRepository;

    @Bean
    public MeterBinder caseMetrics() {
        return registry -> {
            Gauge.builder("sla.monitoring.open_cases", repairCaseRepository, repo -> {
                        try {
                            return repo.countOpenCases();
                        } catch (Exception e) {
                            log.warn("Failed to count open repair cases", e);
                            return 0;
                        }
                    })
                    .description("Repair cases not yet completed or cancelled")
                    .register(registry);

            log.info("Case metrics registered");
        };
    }
}
