package com.urbanzen.analytics.sink;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.urbanzen.common.dto.anomaly.AnomalyResult;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;

import java.time.Duration;

/**
 * Latest-state entry for one device, written on every accepted event.
 *
 * @param result the scoring outcome, or {@code null} when the event could not be scored
 */
public record CacheUpdate(String key, Payload payload, Duration ttl) {

    public static CacheUpdate of(TelemetryEvent event, AnomalyResult result, Duration ttl) {
        return new CacheUpdate(keyFor(event.deviceId()), new Payload(event, result), ttl);
    }

    public static String keyFor(String deviceId) {
        return "device:" + deviceId + ":latest";
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Payload(
        @JsonProperty("event") TelemetryEvent event,
        @JsonProperty("result") AnomalyResult result
    ) {
    }
}
