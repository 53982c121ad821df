package com.z254.noc.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for the NOC service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8088}")
    private int serverPort;

    @Bean
    public OpenAPI nocOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("NOC Alarm Pipeline API")
                        .description("""
                                The NOC service turns firing monitoring alarms into decided, dispatched incidents.
                                
                                ## Features
                                
                                - **Alert Correlation**: Time-window chain grouping of firing alarms
                                - **Anomaly Analysis**: Sigma-threshold outlier detection on key metrics
                                - **Decision Pipeline**: Decide, act and notify per correlated group
                                
                                ## Integration
                                
                                - Monitoring gateway: alarm snapshots and metric statistics
                                - Decision service: root-cause and remediation judgements
                                - Remediation connector: action execution
                                - Kafka: alarm events in, incident records out
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("NOC Team")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server"),
                        new Server()
                                .url("http://noc-service:8088")
                                .description("Kubernetes service")
                ))
                .tags(List.of(
                        new Tag()
                                .name("Events")
                                .description("Alarm event processing"),
                        new Tag()
                                .name("Alarms")
                                .description("Current firing alarms and incident history"),
                        new Tag()
                                .name("Services")
                                .description("Signal source monitoring and metric analysis")
                ));
    }
}
