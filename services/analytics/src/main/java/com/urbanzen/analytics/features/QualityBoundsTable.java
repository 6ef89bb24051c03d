package com.urbanzen.analytics.features;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Quality-field bounds: fleet-wide defaults plus per-device-type overrides.
 * A type's own bounds win over the defaults field by field.
 */
public record QualityBoundsTable(
    @JsonProperty("defaults") Map<String, QualityBounds> defaults,
    @JsonProperty("byDeviceType") Map<String, Map<String, QualityBounds>> byDeviceType
) {
    @JsonCreator
    public QualityBoundsTable(@JsonProperty("defaults") Map<String, QualityBounds> defaults,
                              @JsonProperty("byDeviceType") Map<String, Map<String, QualityBounds>> byDeviceType) {
        this.defaults = defaults != null ? Collections.unmodifiableMap(new LinkedHashMap<>(defaults)) : Map.of();
        Map<String, Map<String, QualityBounds>> overrides = new LinkedHashMap<>();
        if (byDeviceType != null) {
            byDeviceType.forEach((type, bounds) -> {
                if (bounds != null && !bounds.isEmpty()) {
                    overrides.put(type.toLowerCase(Locale.ROOT),
                            Collections.unmodifiableMap(new LinkedHashMap<>(bounds)));
                }
            });
        }
        this.byDeviceType = Collections.unmodifiableMap(overrides);
    }

    public static QualityBoundsTable of(Map<String, QualityBounds> defaults) {
        return new QualityBoundsTable(defaults, Map.of());
    }

    public static QualityBoundsTable empty() {
        return new QualityBoundsTable(Map.of(), Map.of());
    }

    /**
     * Effective bounds for {@code deviceType}; unknown or null types get the defaults.
     */
    public Map<String, QualityBounds> boundsFor(String deviceType) {
        Map<String, QualityBounds> overrides = deviceType != null
                ? byDeviceType.get(deviceType.toLowerCase(Locale.ROOT))
                : null;
        if (overrides == null) {
            return defaults;
        }
        Map<String, QualityBounds> merged = new LinkedHashMap<>(defaults);
        merged.putAll(overrides);
        return merged;
    }
}
