package com.urbanzen.analytics.exception;

import lombok.Getter;

/**
 * Offline training aborted because too few samples were available.
 */
@Getter
public class InsufficientDataException extends AnalyticsException {

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Insufficient training data: " + available + " samples, at least " + required + " required");
        this.available = available;
        this.required = required;
    }
}
