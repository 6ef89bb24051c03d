package com.urbanzen.analytics.state;

import com.urbanzen.analytics.config.AnalyticsProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class IdleStateEvictorTest {

    @Test
    void shouldEvictDevicesSilentLongerThanTtl() {
        // Given
        DeviceStateStore store = mock(DeviceStateStore.class);
        AnalyticsProperties properties = new AnalyticsProperties();
        properties.getState().setIdleTtl(Duration.ofHours(2));
        Clock clock = Clock.fixed(Instant.parse("2024-01-15T12:00:00Z"), ZoneOffset.UTC);

        // When
        new IdleStateEvictor(store, properties, clock).evictIdleDevices();

        // Then
        verify(store).evictIdle(Instant.parse("2024-01-15T10:00:00Z"));
    }
}
