package com.z254.noc.kafka;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.Alarm;
import com.z254.noc.domain.model.AlertGroup;
import com.z254.noc.domain.model.IncidentRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link IncidentRecordProducer}.
 */
@ExtendWith(MockitoExtension.class)
class IncidentRecordProducerTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private IncidentRecordProducer producer;

    @BeforeEach
    void setUp() {
        producer = new IncidentRecordProducer(kafkaTemplate, new NocProperties());
    }

    @Test
    void publishesKeyedByIncidentId() {
        IncidentRecord record = record();
        RecordMetadata metadata = new RecordMetadata(new TopicPartition("noc.incidents", 0), 0, 0, 0L, 0, 0);
        SendResult<String, Object> sendResult =
                new SendResult<>(new ProducerRecord<>("noc.incidents", "INC-1", record), metadata);
        when(kafkaTemplate.send(eq("noc.incidents"), eq("INC-1"), any()))
                .thenReturn(CompletableFuture.completedFuture(sendResult));

        StepVerifier.create(producer.publish(record)).verifyComplete();

        verify(kafkaTemplate).send("noc.incidents", "INC-1", record);
    }

    @Test
    void surfacesSendFailures() {
        when(kafkaTemplate.send(any(), any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        StepVerifier.create(producer.publish(record()))
                .expectErrorMessage("broker down")
                .verify();
    }

    private static IncidentRecord record() {
        return IncidentRecord.builder()
                .id("INC-1")
                .correlation(AlertGroup.builder().alarm(Alarm.builder().alarmName("cpu-high").build()).build())
                .timestamp(Instant.now())
                .build();
    }
}
