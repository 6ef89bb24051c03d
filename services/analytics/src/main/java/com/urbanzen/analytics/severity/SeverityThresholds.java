package com.urbanzen.analytics.severity;

import com.urbanzen.analytics.config.AnalyticsProperties;

/**
 * Upper score bounds of the critical, high and medium tiers. A score strictly
 * below a bound falls into that tier.
 */
public record SeverityThresholds(double critical, double high, double medium) {

    public static final SeverityThresholds DEFAULTS = new SeverityThresholds(-0.5, -0.3, -0.1);

    public SeverityThresholds {
        if (!(critical < high && high < medium)) {
            throw new IllegalArgumentException(String.format(
                    "Severity thresholds must satisfy critical < high < medium, got %s, %s, %s",
                    critical, high, medium));
        }
    }

    public static SeverityThresholds from(AnalyticsProperties.Severity severity) {
        return new SeverityThresholds(severity.getCritical(), severity.getHigh(), severity.getMedium());
    }
}
