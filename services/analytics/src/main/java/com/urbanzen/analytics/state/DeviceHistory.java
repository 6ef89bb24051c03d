package com.urbanzen.analytics.state;

import com.urbanzen.common.dto.telemetry.TelemetryEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of one device's most recent samples, oldest first.
 */
public final class DeviceHistory {

    private final String deviceId;
    private final List<TelemetryEvent> samples;

    public DeviceHistory(String deviceId, List<TelemetryEvent> samples) {
        this.deviceId = deviceId;
        this.samples = List.copyOf(samples);
    }

    public static DeviceHistory empty(String deviceId) {
        return new DeviceHistory(deviceId, List.of());
    }

    public String deviceId() {
        return deviceId;
    }

    public List<TelemetryEvent> samples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public Optional<TelemetryEvent> latest() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    }

    /**
     * Returns up to {@code limit} of the most recent samples strictly older than
     * {@code timestamp}, oldest first.
     */
    public List<TelemetryEvent> before(Instant timestamp, int limit) {
        List<TelemetryEvent> earlier = new ArrayList<>(Math.min(limit, samples.size()));
        for (int i = samples.size() - 1; i >= 0 && earlier.size() < limit; i--) {
            TelemetryEvent sample = samples.get(i);
            if (sample.timestamp().isBefore(timestamp)) {
                earlier.add(0, sample);
            }
        }
        return earlier;
    }

    @Override
    public String toString() {
        return "DeviceHistory{deviceId=" + deviceId + ", size=" + samples.size() + "}";
    }
}
