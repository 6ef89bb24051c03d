package com.urbanzen.analytics.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.scoring.TrainingSummary;

import java.time.Instant;
import java.util.List;

/**
 * Describes the active model artifact.
 *
 * Example JSON:
 * {
 *   "ready": true,
 *   "artifactId": "5b0c...",
 *   "createdAt": "2024-01-15T00:00:00Z",
 *   "contamination": 0.1,
 *   "featureCount": 39,
 *   "knownDeviceTypes": ["water_sensor", "electricity_meter"],
 *   "training": {"sampleCount": 300, "anomalyRatio": 0.097, "meanScore": 0.42, "stdScore": 0.31}
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelStatusResponse(
    @JsonProperty("ready")
    boolean ready,

    @JsonProperty("artifactId")
    String artifactId,

    @JsonProperty("createdAt")
    Instant createdAt,

    @JsonProperty("contamination")
    Double contamination,

    @JsonProperty("featureCount")
    Integer featureCount,

    @JsonProperty("knownDeviceTypes")
    List<String> knownDeviceTypes,

    @JsonProperty("training")
    TrainingSummary training
) {
    public static ModelStatusResponse of(ModelArtifact artifact) {
        return new ModelStatusResponse(
                true,
                artifact.artifactId(),
                artifact.createdAt(),
                artifact.contamination(),
                artifact.dimensions(),
                artifact.knownDeviceTypes(),
                artifact.trainingSummary());
    }

    public static ModelStatusResponse notReady() {
        return new ModelStatusResponse(false, null, null, null, null, null, null);
    }
}
