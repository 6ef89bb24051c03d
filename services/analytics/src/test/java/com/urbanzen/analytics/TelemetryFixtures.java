package com.urbanzen.analytics;

import com.urbanzen.analytics.features.DeviceProfileRegistry;
import com.urbanzen.analytics.features.FeatureExtractor;
import com.urbanzen.analytics.features.FeatureVector;
import com.urbanzen.analytics.scoring.AnomalyModelTrainer;
import com.urbanzen.analytics.scoring.ForestSettings;
import com.urbanzen.analytics.state.DeviceHistory;
import com.urbanzen.analytics.state.InMemoryDeviceStateStore;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Shared telemetry builders for analytics tests.
 */
public final class TelemetryFixtures {

    public static final String WATER = "water_sensor";
    public static final Instant START = Instant.parse("2024-01-15T00:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC);

    private TelemetryFixtures() {}

    public static TelemetryEvent water(String deviceId, Instant timestamp, double flowRate, double pressure) {
        return TelemetryEvent.of(deviceId, WATER, timestamp, Map.of("flow_rate", flowRate, "pressure", pressure));
    }

    public static TelemetryEvent reading(String deviceId, String deviceType, Instant timestamp,
                                         Map<String, Double> metrics) {
        return TelemetryEvent.of(deviceId, deviceType, timestamp, metrics);
    }

    /**
     * Seeded normal water readings: flow 15 +/- 1, pressure 2.5 +/- 0.1, every
     * five minutes per device.
     */
    public static List<TelemetryEvent> normalWaterHistory(int devices, int perDevice, long seed) {
        Random random = new Random(seed);
        List<TelemetryEvent> events = new ArrayList<>(devices * perDevice);
        for (int d = 0; d < devices; d++) {
            String deviceId = "WS-" + (100 + d);
            for (int i = 0; i < perDevice; i++) {
                Instant timestamp = START.plus(Duration.ofMinutes(5L * i));
                events.add(water(deviceId, timestamp,
                        15.0 + random.nextGaussian(),
                        2.5 + 0.1 * random.nextGaussian()));
            }
        }
        return events;
    }

    public static FeatureExtractor extractor() {
        return new FeatureExtractor(6, 1e-8, ZoneId.of("UTC"), DeviceProfileRegistry.builtIn());
    }

    public static AnomalyModelTrainer trainer() {
        return new AnomalyModelTrainer(0.1, new ForestSettings(50, 128, 42L), 100, FIXED_CLOCK);
    }

    /**
     * Replays events per device through a fresh store, as offline training does.
     */
    public static List<FeatureVector> vectorsOf(List<TelemetryEvent> events, FeatureExtractor extractor) {
        DeviceProfileRegistry registry = DeviceProfileRegistry.builtIn();
        InMemoryDeviceStateStore store = new InMemoryDeviceStateStore(extractor.windowSize());
        List<FeatureVector> vectors = new ArrayList<>(events.size());
        for (TelemetryEvent event : events) {
            DeviceHistory history = store.record(event);
            vectors.add(extractor.extract(event, history, registry.knownDeviceTypes()));
        }
        return vectors;
    }
}
