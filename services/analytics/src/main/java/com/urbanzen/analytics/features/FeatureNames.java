package com.urbanzen.analytics.features;

/**
 * Column names produced by {@link FeatureExtractor}.
 */
public final class FeatureNames {

    private FeatureNames() {}

    // Calendar encodings
    public static final String HOUR_SIN = "hour_sin";
    public static final String HOUR_COS = "hour_cos";
    public static final String DOW_SIN = "dow_sin";
    public static final String DOW_COS = "dow_cos";
    public static final String IS_WEEKEND = "is_weekend";

    // Per-channel suffixes
    public static final String ROLLING_MEAN = "_rolling_mean";
    public static final String ROLLING_STD = "_rolling_std";
    public static final String DIFF_FROM_MEAN = "_diff_from_mean";
    public static final String RATE_OF_CHANGE = "_rate_of_change";

    public static final String DEVICE_PREFIX = "device_";
    public static final String NORMALIZED = "_normalized";

    public static String rollingMean(String channel) {
        return channel + ROLLING_MEAN;
    }

    public static String rollingStd(String channel) {
        return channel + ROLLING_STD;
    }

    public static String diffFromMean(String channel) {
        return channel + DIFF_FROM_MEAN;
    }

    public static String rateOfChange(String channel) {
        return channel + RATE_OF_CHANGE;
    }

    public static String deviceIndicator(String deviceType) {
        return DEVICE_PREFIX + deviceType;
    }

    public static String normalized(String qualityField) {
        return qualityField + NORMALIZED;
    }
}
