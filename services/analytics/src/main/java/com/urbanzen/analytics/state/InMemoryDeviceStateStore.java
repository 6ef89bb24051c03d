package com.urbanzen.analytics.state;

import com.urbanzen.common.dto.telemetry.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed state store with one lock per device.
 *
 * Samples are kept in timestamp order: a late event is inserted where it
 * belongs and a redelivered event (same timestamp) replaces the stored one.
 * Last-seen times come from the store's clock, not from event timestamps.
 */
@Slf4j
public class InMemoryDeviceStateStore implements DeviceStateStore {

    private final int windowSize;
    private final Clock clock;
    private final Map<String, DeviceSlot> slots = new ConcurrentHashMap<>();

    public InMemoryDeviceStateStore(int windowSize, Clock clock) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Window size must be positive: " + windowSize);
        }
        this.windowSize = windowSize;
        this.clock = clock;
    }

    public InMemoryDeviceStateStore(int windowSize) {
        this(windowSize, Clock.systemUTC());
    }

    @Override
    public DeviceHistory record(TelemetryEvent event) {
        String deviceId = event.deviceId();
        while (true) {
            DeviceSlot slot = slots.computeIfAbsent(deviceId, DeviceSlot::new);
            synchronized (slot) {
                // lost a race with eviction; retry against a fresh slot
                if (slot.retired) {
                    continue;
                }
                slot.insert(event, windowSize);
                slot.lastSeen = clock.instant();
                return slot.snapshot();
            }
        }
    }

    @Override
    public DeviceHistory get(String deviceId) {
        DeviceSlot slot = slots.get(deviceId);
        if (slot == null) {
            return DeviceHistory.empty(deviceId);
        }
        synchronized (slot) {
            return slot.retired ? DeviceHistory.empty(deviceId) : slot.snapshot();
        }
    }

    @Override
    public int evictIdle(Instant cutoff) {
        int evicted = 0;
        for (DeviceSlot slot : slots.values()) {
            synchronized (slot) {
                if (!slot.retired && slot.lastSeen.isBefore(cutoff)) {
                    slot.retired = true;
                    slots.remove(slot.deviceId, slot);
                    evicted++;
                }
            }
        }
        if (evicted > 0) {
            log.info("Evicted history for {} idle devices (last seen before {})", evicted, cutoff);
        }
        return evicted;
    }

    @Override
    public int trackedDevices() {
        return slots.size();
    }

    public int windowSize() {
        return windowSize;
    }

    private static final class DeviceSlot {
        private final String deviceId;
        private final List<TelemetryEvent> samples = new ArrayList<>();
        private Instant lastSeen = Instant.EPOCH;
        private boolean retired;

        private DeviceSlot(String deviceId) {
            this.deviceId = deviceId;
        }

        private void insert(TelemetryEvent event, int windowSize) {
            int position = samples.size();
            while (position > 0 && samples.get(position - 1).timestamp().isAfter(event.timestamp())) {
                position--;
            }
            if (position > 0 && samples.get(position - 1).timestamp().equals(event.timestamp())) {
                samples.set(position - 1, event);
            } else {
                samples.add(position, event);
            }
            while (samples.size() > windowSize) {
                samples.remove(0);
            }
        }

        private DeviceHistory snapshot() {
            return new DeviceHistory(deviceId, samples);
        }
    }
}
