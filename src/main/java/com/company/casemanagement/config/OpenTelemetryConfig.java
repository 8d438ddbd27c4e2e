package com.company.casemanagement.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.autoconfigure.AutoConfiguredOpenTelemetrySdk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

@Configuration
@Slf4j
@RequiredArgsConstructor
public class OpenTelemetryConfig {

    private final TracingProperties tracingProperties;

    @Bean
    public OpenTelemetry openTelemetry() {
        log.info("Initializing OpenTelemetry for {} (exporter: {})",
                tracingProperties.getServiceName(), tracingProperties.getExporter());

        return AutoConfiguredOpenTelemetrySdk.builder()
                .addPropertiesSupplier(this::sdkProperties)
                .disableShutdownHook()
                .build()
                .getOpenTelemetrySdk();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(tracingProperties.getServiceName());
    }

    // Environment variables (OTEL_*) still take precedence over these defaults
    private Map<String, String> sdkProperties() {
        Map<String, String> properties = new HashMap<>();
        properties.put("otel.service.name", tracingProperties.getServiceName());
        properties.put("otel.traces.exporter", tracingProperties.getExporter());
        properties.put("otel.metrics.exporter", "none");
        properties.put("otel.logs.exporter", "none");
        if (tracingProperties.getEndpoint() != null && !tracingProperties.getEndpoint().isBlank()) {
            properties.put("otel.exporter.otlp.endpoint", tracingProperties.getEndpoint());
        }
        return properties;
    }
}
