package com.z254.noc.client.impl;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.Sample;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientTimeSeriesSourceTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    @Test
    void requestsAverageStatisticsAndSortsDatapoints() {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body("""
                                    {"label": "CPUUtilization", "datapoints": [
                                      {"timestamp": "2024-05-01T10:10:00Z", "average": 30.0, "unit": "Percent"},
                                      {"timestamp": "2024-05-01T10:00:00Z", "average": 10.0, "unit": "Percent"},
                                      {"timestamp": "2024-05-01T10:05:00Z", "average": 20.0, "unit": "Percent"}
                                    ]}
                                    """)
                            .build());
                });
        WebClientTimeSeriesSource source = new WebClientTimeSeriesSource(builder, new NocProperties());

        StepVerifier.create(source.samples("EC2", "CPUUtilization", Duration.ofHours(1), Duration.ofMinutes(5)))
                .assertNext(samples -> {
                    assertThat(samples).extracting(Sample::getValue).containsExactly(10.0, 20.0, 30.0);
                    assertThat(samples.get(0).getTimestamp()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
                })
                .verifyComplete();

        String query = requests.get(0).url().getQuery();
        assertThat(query).contains("namespace=AWS/EC2", "metricName=CPUUtilization", "period=300", "statistic=Average");
    }
}
