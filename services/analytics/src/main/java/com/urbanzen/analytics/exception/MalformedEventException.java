package com.urbanzen.analytics.exception;

/**
 * An inbound message does not have the minimal telemetry shape.
 */
public class MalformedEventException extends AnalyticsException {

    public MalformedEventException(String message) {
        super(message);
    }

    public MalformedEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
