package com.urbanzen.analytics.exception;

import lombok.Getter;

/**
 * A stored model artifact could not be read back into a usable scorer.
 */
@Getter
public class ArtifactCorruptException extends AnalyticsException {

    private final String location;

    public ArtifactCorruptException(String location, String reason) {
        super("Model artifact at " + location + " is corrupt: " + reason);
        this.location = location;
    }

    public ArtifactCorruptException(String location, String reason, Throwable cause) {
        super("Model artifact at " + location + " is corrupt: " + reason, cause);
        this.location = location;
    }
}
