package com.z254.noc.config;

import com.z254.noc.domain.model.NotificationChannel;
import com.z254.noc.domain.model.RemediationRule;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the NOC service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Correlation window, history lookback and relationship strategy</li>
 *     <li>Anomaly analysis parameters and the key metric catalog</li>
 *     <li>Notification channel escalation and delivery endpoints</li>
 *     <li>Integration client settings (monitoring, decision, remediation)</li>
 *     <li>Kafka topics and remediation rules</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "noc")
public class NocProperties {

    private final Correlation correlation = new Correlation();
    private final Analysis analysis = new Analysis();
    private final Notifications notifications = new Notifications();
    private final Monitoring monitoring = new Monitoring();
    private final Decision decision = new Decision();
    private final Remediation remediation = new Remediation();
    private final Incidents incidents = new Incidents();
    private final Kafka kafka = new Kafka();
    private final Health health = new Health();

    /** Remediation rules matched against correlated alarms */
    private List<RemediationRule> rules = new ArrayList<>();

    /**
     * Alert correlation configuration.
     */
    @Data
    public static class Correlation {
        /** Maximum state-transition distance between chain-adjacent alarms */
        @NotNull
        private Duration window = Duration.ofMinutes(5);

        /** How far back the incident history lookup reaches */
        @NotNull
        private Duration historyLookback = Duration.ofHours(24);

        /** Cross-namespace relationship check used by the relatedness predicate */
        @NotNull
        private RelationshipStrategy relationshipStrategy = RelationshipStrategy.NONE;

        /** Dimension keys compared by the TAG strategy */
        private List<String> relationshipTags = new ArrayList<>(List.of("InstanceId"));

        /** Namespace adjacency used by the TOPOLOGY strategy */
        private Map<String, List<String>> topology = new LinkedHashMap<>();
    }

    /**
     * Metric anomaly analysis configuration.
     */
    @Data
    public static class Analysis {
        /** Sub-interval of the fetched statistics */
        @NotNull
        private Duration samplePeriod = Duration.ofMinutes(5);

        /** Look-back window for monitor and insight runs */
        @NotNull
        private Duration defaultWindow = Duration.ofHours(1);

        /** Outlier threshold in standard deviations */
        @Positive
        private double thresholdSigma = 3.0;

        /** Vendor prefix stripped from alarm namespaces to get the signal source */
        private String namespacePrefix = "AWS/";

        /** Key metrics tracked per signal source */
        private Map<String, List<String>> keyMetrics = defaultKeyMetrics();

        private static Map<String, List<String>> defaultKeyMetrics() {
            Map<String, List<String>> catalog = new LinkedHashMap<>();
            catalog.put("EC2", new ArrayList<>(List.of("CPUUtilization", "MemoryUtilization", "DiskSpaceUtilization")));
            catalog.put("RDS", new ArrayList<>(List.of("CPUUtilization", "FreeStorageSpace", "DatabaseConnections")));
            catalog.put("Lambda", new ArrayList<>(List.of("Duration", "Errors", "Throttles")));
            catalog.put("S3", new ArrayList<>(List.of("BucketSizeBytes", "NumberOfObjects")));
            return catalog;
        }
    }

    /**
     * Notification channel selection and delivery configuration.
     */
    @Data
    public static class Notifications {
        /** Channel notified for every severity */
        @NotNull
        private NotificationChannel baseChannel = NotificationChannel.TEAMS;

        /** Channels added for HIGH and CRITICAL */
        private List<NotificationChannel> escalationChannels =
                new ArrayList<>(List.of(NotificationChannel.SLACK, NotificationChannel.PAGERDUTY));

        /** Channels added for CRITICAL only */
        private List<NotificationChannel> criticalChannels =
                new ArrayList<>(List.of(NotificationChannel.EMAIL));

        private String teamsWebhookUrl;
        private String slackWebhookUrl;
        private String pagerdutyUrl = "https://api.pagerduty.com/incidents";
        private String pagerdutyApiKey;
        private String emailGatewayUrl;
        private String emailFrom;
        private List<String> emailRecipients = new ArrayList<>();

        /** Gateway publishing NOTIFY actions to their topic */
        private String topicGatewayUrl;

        /** Console link rendered into Teams cards */
        private String consoleUrl = "https://console.aws.amazon.com/cloudwatch/home?region=us-east-1#alarmsV2:alarm/";
    }

    /**
     * Monitoring gateway (alarms and metric statistics) client configuration.
     */
    @Data
    public static class Monitoring {
        @NotBlank
        private String url = "http://localhost:8090";

        private Duration readTimeout = Duration.ofSeconds(30);
    }

    /**
     * Decision service client configuration.
     */
    @Data
    public static class Decision {
        @NotBlank
        private String url = "http://localhost:8091";

        private Duration readTimeout = Duration.ofSeconds(60);
    }

    /**
     * Remediation connector client configuration.
     */
    @Data
    public static class Remediation {
        @NotBlank
        private String url = "http://localhost:8092";

        /** Default to dry-run mode for safety */
        private boolean dryRunDefault = true;
    }

    /**
     * In-memory incident history configuration.
     */
    @Data
    public static class Incidents {
        /** Records older than this are evicted from the in-memory store */
        @NotNull
        private Duration retention = Duration.ofDays(7);

        @Positive
        private int maxRecords = 10_000;
    }

    /**
     * Kafka topic configuration.
     */
    @Data
    public static class Kafka {
        private final Topics topics = new Topics();

        @Data
        public static class Topics {
            private String alarmEvents = "noc.alarm-events";
            private String incidents = "noc.incidents";
        }
    }

    /**
     * Health reporting thresholds.
     */
    @Data
    public static class Health {
        /** Consecutive failed pipeline runs before the service reports DOWN */
        @Positive
        private int maxConsecutiveFailures = 3;
    }

    /**
     * Cross-namespace relationship check applied after the namespace comparison.
     */
    public enum RelationshipStrategy {
        /** Never related across namespaces */
        NONE,
        /** Related when namespaces are equal */
        NAMESPACE,
        /** Related when a configured dimension carries the same value */
        TAG,
        /** Related when the configured topology links the two namespaces */
        TOPOLOGY
    }
}
