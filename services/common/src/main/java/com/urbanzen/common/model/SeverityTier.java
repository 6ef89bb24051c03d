package com.urbanzen.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Anomaly severity tiers, declared from least to most severe.
 */
public enum SeverityTier {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    SeverityTier(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(SeverityTier other) {
        return compareTo(other) >= 0;
    }

    @JsonCreator
    public static SeverityTier fromValue(String value) {
        for (SeverityTier tier : SeverityTier.values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + value);
    }
}
