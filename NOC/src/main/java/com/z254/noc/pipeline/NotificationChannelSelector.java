package com.z254.noc.pipeline;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.NotificationChannel;
import com.z254.noc.domain.model.Severity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps incident severity to notification channels.
 * <p>
 * Selection is cumulative: the base channel always, escalation channels from HIGH,
 * critical-only channels at CRITICAL. Duplicates are dropped, first occurrence wins.
 */
@Component
public class NotificationChannelSelector {

    private final NocProperties.Notifications config;

    public NotificationChannelSelector(NocProperties nocProperties) {
        this.config = nocProperties.getNotifications();
    }

    public List<NotificationChannel> select(Severity severity) {
        Severity effective = severity != null ? severity : Severity.MEDIUM;

        Set<NotificationChannel> channels = new LinkedHashSet<>();
        channels.add(config.getBaseChannel());
        if (effective.isAtLeast(Severity.HIGH)) {
            channels.addAll(config.getEscalationChannels());
        }
        if (effective == Severity.CRITICAL) {
            channels.addAll(config.getCriticalChannels());
        }
        return List.copyOf(channels);
    }
}
