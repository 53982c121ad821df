package com.z254.noc.notify;

import com.z254.noc.domain.model.NotificationChannel;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Delivers rendered notification payloads to their endpoints.
 */
public interface NotificationTransport {

    /**
     * Deliver a payload to the endpoint configured for {@code channel}.
     *
     * @return the provider's response line
     */
    Mono<String> deliver(NotificationChannel channel, Map<String, Object> payload);

    /**
     * Publish a message to a notification topic.
     *
     * @return the provider's message id
     */
    Mono<String> publishTopic(String topic, String subject, String message);
}
