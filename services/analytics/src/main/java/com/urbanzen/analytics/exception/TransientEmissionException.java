package com.urbanzen.analytics.exception;

import lombok.Getter;

/**
 * A downstream sink rejected an emission in a way that may succeed on retry.
 */
@Getter
public class TransientEmissionException extends AnalyticsException {

    private final String sink;

    public TransientEmissionException(String sink, String message, Throwable cause) {
        super(sink + " emission failed: " + message, cause);
        this.sink = sink;
    }
}
