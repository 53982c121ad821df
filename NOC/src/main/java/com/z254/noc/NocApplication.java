package com.z254.noc;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * NOC - alarm correlation and incident response pipeline.
 *
 * <p>NOC provides:
 * <ul>
 *   <li>Alert correlation - chain clustering of firing alarms into incident candidates</li>
 *   <li>Anomaly analysis - 3-sigma outlier detection over recent metric samples</li>
 *   <li>Orchestration - decide, act and notify for every correlated group</li>
 * </ul>
 *
 * <p>NOC integrates with:
 * <ul>
 *   <li>Monitoring gateway - firing alarms and metric statistics</li>
 *   <li>Decision service - root cause and remediation judgments</li>
 *   <li>Remediation connector - action execution</li>
 *   <li>Kafka - alarm event ingress and incident egress</li>
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties
public class NocApplication {

    public static void main(String[] args) {
        SpringApplication.run(NocApplication.class, args);
    }
}
