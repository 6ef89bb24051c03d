package com.urbanzen.common.dto.telemetry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One timestamped measurement snapshot from one device, as consumed from the
 * telemetry topic. Only the device id and timestamp are required; a heartbeat
 * may carry quality fields and no measurements.
 *
 * Example JSON:
 * {
 *   "deviceId": "WM001",
 *   "deviceType": "water_sensor",
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "metrics": {"flow_rate": 15.2, "pressure": 2.4},
 *   "batteryLevel": 92.0,
 *   "signalStrength": -61.0
 * }
 */
public record TelemetryEvent(
    @NotBlank(message = "Device ID is required")
    @JsonProperty("deviceId")
    String deviceId,

    @JsonProperty("deviceType")
    String deviceType,

    @NotNull(message = "Timestamp is required")
    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("metrics")
    Map<String, Double> metrics,

    @JsonProperty("batteryLevel")
    Double batteryLevel,

    @JsonProperty("signalStrength")
    Double signalStrength,

    @JsonProperty("qualityScore")
    Double qualityScore
) {
    public static final String BATTERY_LEVEL = "battery_level";
    public static final String SIGNAL_STRENGTH = "signal_strength";
    public static final String QUALITY_SCORE = "quality_score";

    @JsonCreator
    public TelemetryEvent(
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("deviceType") String deviceType,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("metrics") Map<String, Double> metrics,
        @JsonProperty("batteryLevel") Double batteryLevel,
        @JsonProperty("signalStrength") Double signalStrength,
        @JsonProperty("qualityScore") Double qualityScore
    ) {
        this.deviceId = deviceId;
        this.deviceType = deviceType;
        this.timestamp = timestamp;
        this.metrics = metrics != null ? copyWithoutNulls(metrics) : Map.of();
        this.batteryLevel = batteryLevel;
        this.signalStrength = signalStrength;
        this.qualityScore = qualityScore;
    }

    /**
     * Convenience factory for events without quality fields.
     */
    public static TelemetryEvent of(String deviceId, String deviceType, Instant timestamp,
                                    Map<String, Double> metrics) {
        return new TelemetryEvent(deviceId, deviceType, timestamp, metrics, null, null, null);
    }

    /**
     * Quality and connectivity fields that are present, keyed by their feature name.
     */
    @JsonIgnore
    public Map<String, Double> qualityFields() {
        Map<String, Double> fields = new LinkedHashMap<>();
        if (batteryLevel != null) {
            fields.put(BATTERY_LEVEL, batteryLevel);
        }
        if (signalStrength != null) {
            fields.put(SIGNAL_STRENGTH, signalStrength);
        }
        if (qualityScore != null) {
            fields.put(QUALITY_SCORE, qualityScore);
        }
        return fields;
    }

    private static Map<String, Double> copyWithoutNulls(Map<String, Double> source) {
        Map<String, Double> copy = new LinkedHashMap<>();
        source.forEach((name, value) -> {
            if (name != null && value != null) {
                copy.put(name, value);
            }
        });
        return Collections.unmodifiableMap(copy);
    }
}
