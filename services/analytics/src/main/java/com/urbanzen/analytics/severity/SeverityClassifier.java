package com.urbanzen.analytics.severity;

import com.urbanzen.common.model.SeverityTier;

/**
 * Maps an anomaly score onto a severity tier. Total: every score, NaN
 * included, gets a tier.
 */
public class SeverityClassifier {

    private final SeverityThresholds thresholds;

    public SeverityClassifier(SeverityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    public SeverityTier classify(double score) {
        if (score < thresholds.critical()) {
            return SeverityTier.CRITICAL;
        }
        if (score < thresholds.high()) {
            return SeverityTier.HIGH;
        }
        if (score < thresholds.medium()) {
            return SeverityTier.MEDIUM;
        }
        return SeverityTier.LOW;
    }

    public SeverityThresholds thresholds() {
        return thresholds;
    }
}
