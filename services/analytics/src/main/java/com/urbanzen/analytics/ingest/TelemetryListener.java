package com.urbanzen.analytics.ingest;

import com.urbanzen.analytics.exception.MalformedEventException;
import com.urbanzen.analytics.pipeline.StreamingCoordinator;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Feeds the telemetry topic into the streaming coordinator.
 */
@Component
public class TelemetryListener {

    private static final Logger log = LoggerFactory.getLogger(TelemetryListener.class);

    private final TelemetryEventDecoder decoder;
    private final StreamingCoordinator coordinator;

    public TelemetryListener(TelemetryEventDecoder decoder, StreamingCoordinator coordinator) {
        this.decoder = decoder;
        this.coordinator = coordinator;
    }

    @KafkaListener(
            topics = "${analytics.kafka.telemetry-topic:device-telemetry}",
            groupId = "${spring.kafka.consumer.group-id:analytics-service}")
    public void onTelemetry(ConsumerRecord<String, String> record) {
        TelemetryEvent event;
        try {
            event = decoder.decode(record.value());
        } catch (MalformedEventException e) {
            coordinator.rejectUndecodable(e);
            log.debug("Malformed record at partition={}, offset={}", record.partition(), record.offset());
            return;
        }
        coordinator.submit(event);
    }
}
