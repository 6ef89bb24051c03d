package com.urbanzen.analytics.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Measurement channels that carry signal for one device type, and the quality
 * bounds this type overrides. Fields without an override use the fleet defaults.
 */
public record DeviceProfile(String deviceType, List<String> channels, Map<String, QualityBounds> qualityBounds) {

    public DeviceProfile {
        channels = List.copyOf(channels);
        qualityBounds = qualityBounds != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(qualityBounds))
                : Map.of();
    }

    public DeviceProfile(String deviceType, List<String> channels) {
        this(deviceType, channels, Map.of());
    }

    public boolean tracks(String channel) {
        return channels.contains(channel);
    }
}
