package com.urbanzen.analytics.pipeline;

/**
 * Point-in-time counters of the streaming coordinator.
 */
public record PipelineStats(
    long received,
    long malformed,
    long failed,
    long anomalies,
    long droppedEmissions,
    int trackedDevices,
    int queuedEvents,
    boolean running
) {
}
