package com.z254.noc.pipeline;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.NotificationChannel;
import com.z254.noc.domain.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.z254.noc.domain.model.NotificationChannel.EMAIL;
import static com.z254.noc.domain.model.NotificationChannel.PAGERDUTY;
import static com.z254.noc.domain.model.NotificationChannel.SLACK;
import static com.z254.noc.domain.model.NotificationChannel.TEAMS;
import static org.assertj.core.api.Assertions.assertThat;

class NotificationChannelSelectorTest {

    private NocProperties properties;
    private NotificationChannelSelector selector;

    @BeforeEach
    void setUp() {
        properties = new NocProperties();
        selector = new NotificationChannelSelector(properties);
    }

    @Test
    void lowAndMediumUseOnlyTheBaseChannel() {
        assertThat(selector.select(Severity.LOW)).containsExactly(TEAMS);
        assertThat(selector.select(Severity.MEDIUM)).containsExactly(TEAMS);
    }

    @Test
    void highAddsEscalationChannels() {
        assertThat(selector.select(Severity.HIGH)).containsExactly(TEAMS, SLACK, PAGERDUTY);
    }

    @Test
    void criticalAddsEveryChannel() {
        assertThat(selector.select(Severity.CRITICAL)).containsExactly(TEAMS, SLACK, PAGERDUTY, EMAIL);
    }

    @Test
    void missingSeverityIsTreatedAsMedium() {
        assertThat(selector.select(null)).containsExactly(TEAMS);
    }

    @Test
    void duplicatesAreDroppedKeepingFirstOccurrence() {
        properties.getNotifications().setBaseChannel(SLACK);
        properties.getNotifications().setCriticalChannels(new ArrayList<>(List.of(SLACK, EMAIL)));

        List<NotificationChannel> channels = selector.select(Severity.CRITICAL);

        assertThat(channels).containsExactly(SLACK, PAGERDUTY, EMAIL);
    }
}
