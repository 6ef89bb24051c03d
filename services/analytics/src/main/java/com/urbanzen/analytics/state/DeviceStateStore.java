package com.urbanzen.analytics.state;

import com.urbanzen.common.dto.telemetry.TelemetryEvent;

import java.time.Instant;

/**
 * Rolling per-device sample history backing feature extraction.
 *
 * Implementations must serialize updates for the same device identifier while
 * letting different devices proceed independently.
 */
public interface DeviceStateStore {

    /**
     * Appends the event to its device's history, evicting the oldest samples
     * beyond the window, and returns the updated snapshot.
     */
    DeviceHistory record(TelemetryEvent event);

    /**
     * Returns the current snapshot, or an empty history for unseen devices.
     */
    DeviceHistory get(String deviceId);

    /**
     * Drops devices last seen before {@code cutoff}.
     *
     * @return number of devices evicted
     */
    int evictIdle(Instant cutoff);

    int trackedDevices();
}
