package com.z254.noc.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Delivery result for one notification channel.
 */
@Value
@Builder
public class NotificationOutcome {

    NotificationChannel channel;

    ResultStatus status;

    /** Provider response identifier or status line */
    String response;

    String error;

    public static NotificationOutcome delivered(NotificationChannel channel, String response) {
        return NotificationOutcome.builder()
                .channel(channel)
                .status(ResultStatus.SUCCESS)
                .response(response)
                .build();
    }

    public static NotificationOutcome failed(NotificationChannel channel, String error) {
        return NotificationOutcome.builder()
                .channel(channel)
                .status(ResultStatus.ERROR)
                .error(error)
                .build();
    }
}
