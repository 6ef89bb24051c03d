package com.urbanzen.analytics.exception;

/**
 * Root of the analytics pipeline failures. All failures are isolated to the
 * call or event that raised them.
 */
public class AnalyticsException extends RuntimeException {

    public AnalyticsException(String message) {
        super(message);
    }

    public AnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
