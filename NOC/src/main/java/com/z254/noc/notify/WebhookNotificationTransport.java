package com.z254.noc.notify;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * HTTP transport posting notification payloads to webhook endpoints.
 * <p>
 * Deliveries are attempted once; a missing endpoint fails that delivery only.
 */
@Slf4j
@Component
public class WebhookNotificationTransport implements NotificationTransport {

    private final WebClient webClient;
    private final NocProperties.Notifications config;

    public WebhookNotificationTransport(WebClient.Builder webClientBuilder,
                                        NocProperties nocProperties) {
        this.webClient = webClientBuilder.build();
        this.config = nocProperties.getNotifications();
    }

    @Override
    public Mono<String> deliver(NotificationChannel channel, Map<String, Object> payload) {
        String url = switch (channel) {
            case TEAMS -> config.getTeamsWebhookUrl();
            case SLACK -> config.getSlackWebhookUrl();
            case PAGERDUTY -> config.getPagerdutyUrl();
            case EMAIL -> config.getEmailGatewayUrl();
        };
        if (isBlank(url)) {
            return Mono.error(new IllegalStateException(channel.toJson() + " endpoint not configured"));
        }
        if (channel == NotificationChannel.PAGERDUTY && isBlank(config.getPagerdutyApiKey())) {
            return Mono.error(new IllegalStateException("PagerDuty API key not configured"));
        }

        return webClient.post()
                .uri(url)
                .headers(headers -> {
                    if (channel == NotificationChannel.PAGERDUTY) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Token token=" + config.getPagerdutyApiKey());
                    }
                })
                .bodyValue(payload)
                .retrieve()
                .toEntity(String.class)
                .map(response -> response.getStatusCode().value() + " " + (response.getBody() != null ? response.getBody() : ""))
                .doOnError(error -> log.error("Failed to send {} notification: {}", channel.toJson(), error.getMessage()));
    }

    @Override
    public Mono<String> publishTopic(String topic, String subject, String message) {
        if (isBlank(config.getTopicGatewayUrl())) {
            return Mono.error(new IllegalStateException("Topic gateway not configured"));
        }

        return webClient.post()
                .uri(config.getTopicGatewayUrl() + "/api/v1/topics/{topic}/messages", topic)
                .bodyValue(Map.of("subject", subject, "message", message))
                .retrieve()
                .bodyToMono(TopicPublishResponse.class)
                .map(TopicPublishResponse::messageId)
                .doOnError(error -> log.error("Failed to publish to topic {}: {}", topic, error.getMessage()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    record TopicPublishResponse(String messageId) {
    }
}
