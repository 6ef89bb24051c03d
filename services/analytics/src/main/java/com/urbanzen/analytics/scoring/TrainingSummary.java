package com.urbanzen.analytics.scoring;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Decision-value statistics over the training set, recorded when a model is fitted.
 *
 * @param anomalyRatio share of training rows with a negative decision value
 */
public record TrainingSummary(
    @JsonProperty("sampleCount") int sampleCount,
    @JsonProperty("anomalyRatio") double anomalyRatio,
    @JsonProperty("meanScore") double meanScore,
    @JsonProperty("stdScore") double stdScore
) {
    public static TrainingSummary of(double[] decisionValues) {
        int n = decisionValues.length;
        if (n == 0) {
            return new TrainingSummary(0, 0.0, 0.0, 0.0);
        }
        int anomalies = 0;
        double sum = 0.0;
        for (double value : decisionValues) {
            if (value < 0) {
                anomalies++;
            }
            sum += value;
        }
        double mean = sum / n;
        double squares = 0.0;
        for (double value : decisionValues) {
            squares += (value - mean) * (value - mean);
        }
        return new TrainingSummary(n, (double) anomalies / n, mean, Math.sqrt(squares / n));
    }
}
