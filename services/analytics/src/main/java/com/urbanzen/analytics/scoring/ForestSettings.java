package com.urbanzen.analytics.scoring;

import com.urbanzen.analytics.config.AnalyticsProperties;

/**
 * Random Cut Forest hyperparameters.
 */
public record ForestSettings(int numberOfTrees, int sampleSize, long randomSeed) {

    public ForestSettings {
        if (numberOfTrees < 1) {
            throw new IllegalArgumentException("numberOfTrees must be positive: " + numberOfTrees);
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("sampleSize must be at least 2: " + sampleSize);
        }
    }

    public static ForestSettings from(AnalyticsProperties.Scoring scoring) {
        return new ForestSettings(scoring.getNumberOfTrees(), scoring.getSampleSize(), scoring.getRandomSeed());
    }
}
