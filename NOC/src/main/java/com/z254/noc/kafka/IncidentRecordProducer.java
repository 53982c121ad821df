package com.z254.noc.kafka;

import com.z254.noc.client.IncidentSink;
import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.IncidentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Kafka producer publishing assembled incident records to the incidents topic.
 */
@Slf4j
@Component
public class IncidentRecordProducer implements IncidentSink {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final NocProperties nocProperties;

    public IncidentRecordProducer(KafkaTemplate<String, Object> kafkaTemplate,
                                  NocProperties nocProperties) {
        this.kafkaTemplate = kafkaTemplate;
        this.nocProperties = nocProperties;
    }

    @Override
    public Mono<Void> publish(IncidentRecord record) {
        String topic = nocProperties.getKafka().getTopics().getIncidents();

        return Mono.fromFuture(() -> kafkaTemplate.send(topic, record.getId(), record))
                .doOnNext(result -> log.info("Published incident: id={}, topic={}, partition={}",
                        record.getId(), topic, result.getRecordMetadata().partition()))
                .doOnError(error -> log.error("Failed to publish incident: id={}, error={}",
                        record.getId(), error.getMessage()))
                .then();
    }

    @Override
    public String name() {
        return "kafka-incidents";
    }
}
