package com.urbanzen.analytics.features;

import com.urbanzen.analytics.config.AnalyticsProperties;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;
import com.urbanzen.common.model.DeviceType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Capability table mapping a device type to its profile, plus the fixed
 * quality-field bounds. New device types are registered through configuration.
 */
public class DeviceProfileRegistry {

    private final Map<String, DeviceProfile> profiles;
    private final QualityBoundsTable qualityBounds;

    /**
     * @param defaultQualityBounds fleet-wide bounds; profiles may override them per field
     */
    public DeviceProfileRegistry(Map<String, DeviceProfile> profiles, Map<String, QualityBounds> defaultQualityBounds) {
        Map<String, DeviceProfile> normalized = new LinkedHashMap<>();
        Map<String, Map<String, QualityBounds>> overrides = new LinkedHashMap<>();
        profiles.forEach((type, profile) -> {
            String key = type.toLowerCase(Locale.ROOT);
            normalized.put(key, profile);
            overrides.put(key, profile.qualityBounds());
        });
        this.profiles = Collections.unmodifiableMap(normalized);
        this.qualityBounds = new QualityBoundsTable(defaultQualityBounds, overrides);
    }

    /**
     * Built-in profiles for the deployed device fleet.
     */
    public static DeviceProfileRegistry builtIn() {
        return new DeviceProfileRegistry(defaultProfiles(), defaultQualityBounds());
    }

    /**
     * Built-in profiles with configured profiles and bounds layered on top.
     */
    public static DeviceProfileRegistry from(AnalyticsProperties.Features features) {
        Map<String, DeviceProfile> profiles = defaultProfiles();
        features.getProfiles().forEach((type, profile) ->
                profiles.put(type, new DeviceProfile(type, profile.getChannels(), toBounds(profile.getQualityBounds()))));

        Map<String, QualityBounds> bounds = defaultQualityBounds();
        bounds.putAll(toBounds(features.getQualityBounds()));

        return new DeviceProfileRegistry(profiles, bounds);
    }

    public Optional<DeviceProfile> profile(String deviceType) {
        if (deviceType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(deviceType.toLowerCase(Locale.ROOT)));
    }

    /**
     * Registered device types in registration order; this is the one-hot column order.
     */
    public List<String> knownDeviceTypes() {
        return List.copyOf(profiles.keySet());
    }

    /**
     * Quality bounds for every registered type; recorded in the artifact at training time.
     */
    public QualityBoundsTable qualityBounds() {
        return qualityBounds;
    }

    private static Map<String, DeviceProfile> defaultProfiles() {
        Map<String, DeviceProfile> profiles = new LinkedHashMap<>();
        register(profiles, DeviceType.WATER_SENSOR,
                "flow_rate", "pressure", "ph_level", "turbidity", "temperature", "chlorine_level");
        register(profiles, DeviceType.ELECTRICITY_METER,
                "voltage", "current", "power", "frequency", "power_consumption");
        register(profiles, DeviceType.TRAFFIC_CAMERA,
                "vehicle_count", "avg_speed", "congestion_level");
        register(profiles, DeviceType.AIR_QUALITY_SENSOR,
                "pm25", "pm10", "co2", "temperature");
        return profiles;
    }

    private static void register(Map<String, DeviceProfile> profiles, DeviceType type, String... channels) {
        profiles.put(type.getValue(), new DeviceProfile(type.getValue(), new ArrayList<>(List.of(channels))));
    }

    private static Map<String, QualityBounds> toBounds(Map<String, AnalyticsProperties.Range> ranges) {
        Map<String, QualityBounds> bounds = new LinkedHashMap<>();
        ranges.forEach((field, range) -> bounds.put(field, new QualityBounds(range.getMin(), range.getMax())));
        return bounds;
    }

    private static Map<String, QualityBounds> defaultQualityBounds() {
        Map<String, QualityBounds> bounds = new LinkedHashMap<>();
        bounds.put(TelemetryEvent.BATTERY_LEVEL, new QualityBounds(0.0, 100.0));
        bounds.put(TelemetryEvent.SIGNAL_STRENGTH, new QualityBounds(-120.0, 0.0));
        bounds.put(TelemetryEvent.QUALITY_SCORE, new QualityBounds(0.0, 1.0));
        return bounds;
    }
}
