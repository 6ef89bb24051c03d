package com.urbanzen.analytics.state;

import com.urbanzen.analytics.config.AnalyticsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Periodically drops history for devices that stopped reporting.
 * Only active when {@code analytics.state.idle-ttl} is set.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "analytics.state", name = "idle-ttl")
public class IdleStateEvictor {

    private final DeviceStateStore stateStore;
    private final Duration idleTtl;
    private final Clock clock;

    public IdleStateEvictor(DeviceStateStore stateStore, AnalyticsProperties properties, Clock clock) {
        this.stateStore = stateStore;
        this.idleTtl = properties.getState().getIdleTtl();
        this.clock = clock;
        log.info("Idle device eviction enabled, ttl={}", idleTtl);
    }

    @Scheduled(fixedDelayString = "${analytics.state.eviction-interval-ms:60000}")
    public void evictIdleDevices() {
        stateStore.evictIdle(clock.instant().minus(idleTtl));
    }
}
