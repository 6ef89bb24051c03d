package com.urbanzen.analytics.sink;

import com.urbanzen.common.dto.alert.AlertEvent;

/**
 * Destination for anomaly alerts.
 */
public interface AlertSink {

    /**
     * Publishes one alert.
     *
     * @throws com.urbanzen.analytics.exception.TransientEmissionException if the
     *         alert was definitely not delivered and may be retried
     */
    void publish(AlertEvent alert);

    /**
     * Pushes out anything buffered. Called on shutdown.
     */
    default void flush() {
    }
}
