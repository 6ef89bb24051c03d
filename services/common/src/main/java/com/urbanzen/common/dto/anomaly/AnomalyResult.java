package com.urbanzen.common.dto.anomaly;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.urbanzen.common.model.SeverityTier;

import java.time.Instant;
import java.util.Map;

/**
 * Outcome of scoring one telemetry event.
 * Lower scores are more anomalous; negative scores carry the anomaly verdict.
 *
 * Example JSON:
 * {
 *   "deviceId": "WM001",
 *   "deviceType": "water_sensor",
 *   "anomalyScore": -0.42,
 *   "anomaly": true,
 *   "severity": "high",
 *   "timestamp": "2024-01-15T10:30:00Z",
 *   "metrics": {"flow_rate": 150.0}
 * }
 */
public record AnomalyResult(
    @JsonProperty("deviceId")
    String deviceId,

    @JsonProperty("deviceType")
    String deviceType,

    @JsonProperty("anomalyScore")
    double anomalyScore,

    @JsonProperty("anomaly")
    boolean anomaly,

    @JsonProperty("severity")
    SeverityTier severity,

    @JsonProperty("timestamp")
    Instant timestamp,

    @JsonProperty("metrics")
    Map<String, Double> metrics
) {
    @JsonCreator
    public AnomalyResult(
        @JsonProperty("deviceId") String deviceId,
        @JsonProperty("deviceType") String deviceType,
        @JsonProperty("anomalyScore") double anomalyScore,
        @JsonProperty("anomaly") boolean anomaly,
        @JsonProperty("severity") SeverityTier severity,
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("metrics") Map<String, Double> metrics
    ) {
        this.deviceId = deviceId;
        this.deviceType = deviceType;
        this.anomalyScore = anomalyScore;
        this.anomaly = anomaly;
        this.severity = severity;
        this.timestamp = timestamp;
        this.metrics = metrics != null ? Map.copyOf(metrics) : Map.of();
    }
}
