package com.z254.noc.kafka;

import com.z254.noc.domain.model.PipelineResult;
import com.z254.noc.observability.NocStructuredLogger;
import com.z254.noc.pipeline.NocOrchestrator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AlarmEventConsumerTest {

    @Mock
    private NocOrchestrator orchestrator;

    @Mock
    private Acknowledgment ack;

    private AlarmEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new AlarmEventConsumer(orchestrator, new NocStructuredLogger());
    }

    @Test
    void processesEventAndAcknowledges() {
        Map<String, Object> event = Map.of("detail", Map.of("alarmName", "cpu-high"));
        when(orchestrator.processEventBlocking(event)).thenReturn(PipelineResult.success(List.of(), List.of()));

        consumer.consume(new ConsumerRecord<>("noc.alarm-events", 0, 42L, "evt-1", event), ack);

        verify(orchestrator).processEventBlocking(event);
        verify(ack).acknowledge();
    }

    @Test
    void acknowledgesEvenWhenProcessingThrows() {
        Map<String, Object> event = Map.of("detail", Map.of());
        when(orchestrator.processEventBlocking(event)).thenThrow(new IllegalStateException("unexpected"));

        consumer.consume(new ConsumerRecord<>("noc.alarm-events", 0, 43L, null, event), ack);

        verify(ack).acknowledge();
    }
}
