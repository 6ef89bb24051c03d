package com.urbanzen.analytics.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered, named feature values for one telemetry event. Values are always finite.
 */
public final class FeatureVector {

    private final Map<String, Double> values;

    private FeatureVector(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the named feature, or 0.0 when this vector does not carry it.
     */
    public double get(String name) {
        return values.getOrDefault(name, 0.0);
    }

    public boolean has(String name) {
        return values.containsKey(name);
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public Map<String, Double> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    /**
     * Projects this vector onto {@code columns}: missing columns become 0.0,
     * extra columns are dropped and the result follows the given order.
     */
    public FeatureVector alignTo(List<String> columns) {
        Map<String, Double> aligned = new LinkedHashMap<>();
        for (String column : columns) {
            aligned.put(column, get(column));
        }
        return new FeatureVector(aligned);
    }

    /**
     * Same projection as {@link #alignTo(List)}, as a dense array.
     */
    public double[] toArray(List<String> columns) {
        double[] dense = new double[columns.size()];
        for (int i = 0; i < dense.length; i++) {
            dense[i] = get(columns.get(i));
        }
        return dense;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof FeatureVector other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureVector" + values;
    }

    public static final class Builder {
        private final Map<String, Double> values = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds a feature; NaN and infinite values are stored as 0.0.
         */
        public Builder put(String name, double value) {
            values.put(name, Double.isFinite(value) ? value : 0.0);
            return this;
        }

        public FeatureVector build() {
            return new FeatureVector(new LinkedHashMap<>(values));
        }
    }
}
