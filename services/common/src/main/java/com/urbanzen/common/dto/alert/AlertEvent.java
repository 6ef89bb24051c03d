package com.urbanzen.common.dto.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.urbanzen.common.dto.anomaly.AnomalyResult;
import com.urbanzen.common.model.SeverityTier;

import java.time.Instant;

/**
 * Alert published to the alerts topic for an anomalous reading.
 *
 * Example JSON:
 * {
 *   "type": "anomaly_detected",
 *   "severity": "critical",
 *   "deviceId": "WM001",
 *   "deviceType": "water_sensor",
 *   "description": "Statistical anomaly detected in water_sensor",
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "anomalyScore": -0.61
 * }
 */
public record AlertEvent(
    @JsonProperty("type")
    String type,

    @JsonProperty("severity")
    SeverityTier severity,

    @JsonProperty("deviceId")
    String deviceId,

    @JsonProperty("deviceType")
    String deviceType,

    @JsonProperty("description")
    String description,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("anomalyScore")
    double anomalyScore
) {
    public static final String ANOMALY_DETECTED = "anomaly_detected";

    @JsonCreator
    public AlertEvent(
        @JsonProperty("type") String type,
        @JsonProperty("severity") SeverityTier severity,
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("deviceType") String deviceType,
        @JsonProperty("description") String description,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("anomalyScore") double anomalyScore
    ) {
        this.type = type;
        this.severity = severity;
        this.deviceId = deviceId;
        this.deviceType = deviceType;
        this.description = description;
        this.timestamp = timestamp;
        this.anomalyScore = anomalyScore;
    }

    /**
     * Derives the alert for an anomalous result.
     */
    public static AlertEvent from(AnomalyResult result) {
        if (!result.anomaly()) {
            throw new IllegalArgumentException("Alerts are only raised for anomalous results");
        }
        return new AlertEvent(
            ANOMALY_DETECTED,
            result.severity(),
            result.deviceId(),
            result.deviceType(),
            "Statistical anomaly detected in " + result.deviceType(),
            result.timestamp(),
            result.anomalyScore()
        );
    }
}
