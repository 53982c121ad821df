package com.z254.noc.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Notification delivery channels.
 */
public enum NotificationChannel {
    TEAMS,
    SLACK,
    PAGERDUTY,
    EMAIL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
