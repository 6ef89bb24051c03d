package com.urbanzen.analytics.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urbanzen.analytics.exception.MalformedEventException;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;

/**
 * Decodes raw JSON payloads from the telemetry topic.
 */
public class TelemetryEventDecoder {

    private final ObjectMapper objectMapper;

    public TelemetryEventDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MalformedEventException if the payload is empty or not a telemetry event
     */
    public TelemetryEvent decode(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new MalformedEventException("Empty telemetry payload");
        }
        try {
            TelemetryEvent event = objectMapper.readValue(payload, TelemetryEvent.class);
            if (event == null) {
                throw new MalformedEventException("Telemetry payload is JSON null");
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Undecodable telemetry payload: " + e.getOriginalMessage(), e);
        }
    }
}
