package com.urbanzen.analytics.sink;

/**
 * Key-value cache holding the latest reading and result per device.
 */
public interface DeviceCache {

    /**
     * Overwrites the entry for the update's key.
     *
     * @throws com.urbanzen.analytics.exception.TransientEmissionException on a retryable failure
     */
    void write(CacheUpdate update);

    default void flush() {
    }
}
