package com.urbanzen.analytics.pipeline;

import java.util.Locale;

/**
 * Steps an event moves through in the coordinator, in order.
 */
public enum ProcessingStage {
    RECEIVED,
    FEATURE_EXTRACTED,
    SCORED,
    CLASSIFIED,
    EMITTED;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
