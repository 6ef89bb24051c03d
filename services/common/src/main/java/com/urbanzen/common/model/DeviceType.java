package com.urbanzen.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Well-known device types reporting to the platform.
 * The set on the wire is open: events from other types are accepted and
 * simply carry no registered profile.
 */
public enum DeviceType {
    WATER_SENSOR("water_sensor"),
    ELECTRICITY_METER("electricity_meter"),
    TRAFFIC_CAMERA("traffic_camera"),
    AIR_QUALITY_SENSOR("air_quality_sensor");

    private final String value;

    DeviceType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Looks up a well-known type by its wire value. Unknown values are not an error.
     */
    public static Optional<DeviceType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (DeviceType type : DeviceType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
