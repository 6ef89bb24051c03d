package com.urbanzen.analytics.health;

import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.pipeline.StreamingCoordinator;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Reports DOWN while no model artifact is active.
 */
@Component("scoring")
public class ScoringHealthIndicator implements HealthIndicator {

    private final AnomalyScorer scorer;
    private final StreamingCoordinator coordinator;

    public ScoringHealthIndicator(AnomalyScorer scorer, StreamingCoordinator coordinator) {
        this.scorer = scorer;
        this.coordinator = coordinator;
    }

    @Override
    public Health health() {
        Optional<ModelArtifact> artifact = scorer.activeArtifact();
        if (artifact.isEmpty()) {
            return Health.down()
                    .withDetail("reason", "no model artifact loaded")
                    .withDetail("pipelineRunning", coordinator.isRunning())
                    .build();
        }
        return Health.up()
                .withDetail("artifactId", artifact.get().artifactId())
                .withDetail("createdAt", artifact.get().createdAt().toString())
                .withDetail("features", artifact.get().dimensions())
                .withDetail("pipelineRunning", coordinator.isRunning())
                .build();
    }
}
