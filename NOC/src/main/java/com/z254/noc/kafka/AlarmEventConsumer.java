package com.z254.noc.kafka;

import com.z254.noc.domain.model.PipelineResult;
import com.z254.noc.observability.NocStructuredLogger;
import com.z254.noc.pipeline.NocOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Kafka consumer for raw alarm state-change events.
 * <p>
 * Each event triggers one pipeline run, processed on the listener thread so runs stay
 * sequential. The offset is acknowledged once the run has finished, whatever its status.
 */
@Slf4j
@Component
public class AlarmEventConsumer {

    private final NocOrchestrator orchestrator;
    private final NocStructuredLogger structuredLogger;

    public AlarmEventConsumer(NocOrchestrator orchestrator,
                              NocStructuredLogger structuredLogger) {
        this.orchestrator = orchestrator;
        this.structuredLogger = structuredLogger;
    }

    @KafkaListener(
            topics = "${noc.kafka.topics.alarm-events:noc.alarm-events}",
            groupId = "${spring.kafka.consumer.group-id:noc-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, Map<String, Object>> record, Acknowledgment ack) {
        String key = record.key() != null ? record.key() : "none";
        try (var scope = structuredLogger.withCorrelationId(key)) {
            log.info("Received alarm event: key={} partition={} offset={}",
                    key, record.partition(), record.offset());

            PipelineResult result = orchestrator.processEventBlocking(record.value());
            if (result != null) {
                log.info("Alarm event processed: key={}, status={}, incidents={}",
                        key, result.getStatus().toJson(), result.getResults().size());
            }
        } catch (RuntimeException e) {
            log.error("Alarm event processing failed: key={}, error={}", key, e.getMessage(), e);
        } finally {
            ack.acknowledge();
        }
    }
}
