package com.urbanzen.analytics.scoring;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Per-column z-score scaling fitted on the training matrix.
 * Columns with zero variance keep a scale of 1.
 */
public record StandardNormalizer(
    @JsonProperty("means") double[] means,
    @JsonProperty("scales") double[] scales
) {
    @JsonCreator
    public StandardNormalizer(@JsonProperty("means") double[] means, @JsonProperty("scales") double[] scales) {
        if (means == null || scales == null || means.length != scales.length) {
            throw new IllegalArgumentException("Normalizer means and scales must be present and the same length");
        }
        this.means = means.clone();
        this.scales = scales.clone();
    }

    public static StandardNormalizer fit(double[][] rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("Cannot fit a normalizer on zero rows");
        }
        int width = rows[0].length;
        double[] means = new double[width];
        double[] scales = new double[width];

        for (double[] row : rows) {
            for (int i = 0; i < width; i++) {
                means[i] += row[i];
            }
        }
        for (int i = 0; i < width; i++) {
            means[i] /= rows.length;
        }

        for (double[] row : rows) {
            for (int i = 0; i < width; i++) {
                double delta = row[i] - means[i];
                scales[i] += delta * delta;
            }
        }
        for (int i = 0; i < width; i++) {
            double std = Math.sqrt(scales[i] / rows.length);
            scales[i] = std > 0.0 ? std : 1.0;
        }
        return new StandardNormalizer(means, scales);
    }

    public int dimensions() {
        return means.length;
    }

    public double[] transform(double[] row) {
        if (row.length != means.length) {
            throw new IllegalArgumentException("Expected " + means.length + " columns, got " + row.length);
        }
        double[] scaled = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            scaled[i] = (row[i] - means[i]) / scales[i];
        }
        return scaled;
    }

    @Override
    public double[] means() {
        return means.clone();
    }

    @Override
    public double[] scales() {
        return scales.clone();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StandardNormalizer other
                && Arrays.equals(means, other.means)
                && Arrays.equals(scales, other.scales);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(means) + Arrays.hashCode(scales);
    }

    @Override
    public String toString() {
        return "StandardNormalizer{dimensions=" + means.length + "}";
    }
}
