package com.z254.noc.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Configured remediation rule.
 * <p>
 * A rule matches an alarm when every criterion it sets matches; a rule that sets
 * no criteria matches every alarm.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationRule {

    private String name;

    /** Exact namespace, e.g. {@code AWS/EC2} */
    private String namespace;

    /** Exact metric name */
    private String metricName;

    /** Regular expression applied to the whole alarm name */
    private String alarmNamePattern;

    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    private String description;

    @Builder.Default
    private List<RemediationAction> actions = new ArrayList<>();

    public boolean matches(Alarm alarm) {
        if (alarm == null) {
            return false;
        }
        if (namespace != null && !namespace.equals(alarm.getNamespace())) {
            return false;
        }
        if (metricName != null && !metricName.equals(alarm.getMetricName())) {
            return false;
        }
        if (alarmNamePattern != null) {
            return alarm.getAlarmName() != null
                    && Pattern.compile(alarmNamePattern).matcher(alarm.getAlarmName()).matches();
        }
        return true;
    }
}
