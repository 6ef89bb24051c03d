package com.urbanzen.analytics.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HealthResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("modelReady")
    boolean modelReady,

    @JsonProperty("pipelineRunning")
    boolean pipelineRunning,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public static HealthResponse of(boolean modelReady, boolean pipelineRunning) {
        return new HealthResponse(modelReady && pipelineRunning ? "UP" : "DOWN",
                modelReady, pipelineRunning, Instant.now());
    }

    public boolean isUp() {
        return "UP".equals(status);
    }
}
