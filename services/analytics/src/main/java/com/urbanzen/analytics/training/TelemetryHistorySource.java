package com.urbanzen.analytics.training;

import com.urbanzen.common.dto.telemetry.TelemetryEvent;

import java.time.Instant;
import java.util.List;

/**
 * Bulk access to stored historical telemetry for offline training.
 */
public interface TelemetryHistorySource {

    /**
     * Returns all stored events with a timestamp at or after {@code since}, in any order.
     */
    List<TelemetryEvent> fetchHistory(Instant since);
}
