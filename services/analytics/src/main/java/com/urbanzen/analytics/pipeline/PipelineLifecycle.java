package com.urbanzen.analytics.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Starts the coordinator lanes before the Kafka listeners and stops them after
 * the listeners, so no consumed event is left without a lane.
 */
@Slf4j
public class PipelineLifecycle implements SmartLifecycle {

    // Kafka listener containers run at Integer.MAX_VALUE - 100
    static final int PHASE = Integer.MAX_VALUE - 200;

    private final StreamingCoordinator coordinator;

    public PipelineLifecycle(StreamingCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @Override
    public void start() {
        coordinator.start();
    }

    @Override
    public void stop() {
        if (!coordinator.shutdown()) {
            log.warn("Streaming coordinator did not shut down cleanly");
        }
    }

    @Override
    public boolean isRunning() {
        return coordinator.isRunning();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
