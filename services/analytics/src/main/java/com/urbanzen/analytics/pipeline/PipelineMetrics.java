package com.urbanzen.analytics.pipeline;

import com.urbanzen.common.model.SeverityTier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.function.Supplier;

/**
 * Micrometer instruments for the streaming pipeline.
 */
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter eventsReceived;
    private final Counter eventsMalformed;
    private final Timer scoringLatency;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.eventsReceived = Counter.builder("analytics.events.received")
                .description("Number of telemetry events received")
                .register(meterRegistry);

        this.eventsMalformed = Counter.builder("analytics.events.malformed")
                .description("Number of telemetry events rejected as malformed")
                .register(meterRegistry);

        this.scoringLatency = Timer.builder("analytics.scoring.latency")
                .description("Time taken to score one feature vector")
                .register(meterRegistry);
    }

    public void eventReceived() {
        eventsReceived.increment();
    }

    public void eventMalformed() {
        eventsMalformed.increment();
    }

    public void eventFailed(ProcessingStage stage) {
        Counter.builder("analytics.events.failed")
                .description("Number of events whose processing failed, by last completed stage")
                .tag("stage", stage.tag())
                .register(meterRegistry)
                .increment();
    }

    public void anomalyDetected(String deviceType, SeverityTier severity) {
        Counter.builder("analytics.anomalies.detected")
                .description("Number of anomalies detected")
                .tag("device_type", deviceType != null ? deviceType : "unknown")
                .tag("severity", severity.getValue())
                .register(meterRegistry)
                .increment();
    }

    public void emissionDropped(String sink) {
        Counter.builder("analytics.emission.dropped")
                .description("Number of emissions dropped after exhausting retries")
                .tag("sink", sink)
                .register(meterRegistry)
                .increment();
    }

    public <T> T timeScoring(Supplier<T> scoring) {
        return scoringLatency.record(scoring);
    }

    public long received() {
        return (long) eventsReceived.count();
    }

    public long malformed() {
        return (long) eventsMalformed.count();
    }

    public long failed() {
        return sum("analytics.events.failed");
    }

    public long anomalies() {
        return sum("analytics.anomalies.detected");
    }

    public long dropped() {
        return sum("analytics.emission.dropped");
    }

    public long dropped(String sink) {
        return (long) meterRegistry.find("analytics.emission.dropped").tag("sink", sink).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }

    private long sum(String name) {
        return (long) meterRegistry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
