package com.company.casemanagement.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "casemanagement.tracing")
public class TracingProperties {

    private String serviceName = "case-management-service";

    // none or otlp
    private String exporter = "none";

    private String endpoint;
}
