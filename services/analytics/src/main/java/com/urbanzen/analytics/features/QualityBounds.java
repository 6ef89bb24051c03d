package com.urbanzen.analytics.features;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Fixed min-max range used to scale a quality field into [0, 1].
 */
public record QualityBounds(
    @JsonProperty("min") double min,
    @JsonProperty("max") double max
) {
    @JsonCreator
    public QualityBounds(@JsonProperty("min") double min, @JsonProperty("max") double max) {
        if (!(max > min)) {
            throw new IllegalArgumentException("Quality bounds need max > min, got [" + min + ", " + max + "]");
        }
        this.min = min;
        this.max = max;
    }

    /**
     * Scales {@code value} into [0, 1], clamping values outside the bounds.
     */
    public double normalize(double value) {
        double scaled = (value - min) / (max - min);
        return Math.max(0.0, Math.min(1.0, scaled));
    }
}
