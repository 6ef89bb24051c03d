package com.urbanzen.analytics.exception;

/**
 * Scoring was requested before any model artifact was activated.
 */
public class ModelNotReadyException extends AnalyticsException {

    public ModelNotReadyException() {
        super("No model artifact is loaded; scoring is unavailable");
    }
}
