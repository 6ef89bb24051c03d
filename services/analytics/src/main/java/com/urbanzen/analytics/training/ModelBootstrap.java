package com.urbanzen.analytics.training;

import com.urbanzen.analytics.artifact.ModelArtifactManager;
import com.urbanzen.analytics.config.AnalyticsProperties;
import com.urbanzen.analytics.exception.AnalyticsException;
import com.urbanzen.analytics.exception.ArtifactCorruptException;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the stored artifact at startup, optionally training one when none is usable.
 * Failures leave the scorer not ready; they never stop the application.
 */
@Component
@Slf4j
public class ModelBootstrap implements ApplicationRunner {

    private final ModelArtifactManager artifactManager;
    private final AnomalyScorer scorer;
    private final OfflineTrainingService trainingService;
    private final AnalyticsProperties properties;

    public ModelBootstrap(ModelArtifactManager artifactManager,
                          AnomalyScorer scorer,
                          OfflineTrainingService trainingService,
                          AnalyticsProperties properties) {
        this.artifactManager = artifactManager;
        this.scorer = scorer;
        this.trainingService = trainingService;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path location = Path.of(properties.getScoring().getArtifactLocation());
        if (Files.exists(location)) {
            try {
                scorer.activate(artifactManager.load(location));
            } catch (ArtifactCorruptException e) {
                log.error("Could not load model artifact: {}", e.getMessage(), e);
            }
        } else {
            log.warn("No model artifact at {}; scoring stays unavailable until one is trained", location);
        }

        if (!scorer.isReady() && properties.getTraining().isTrainOnStartup()) {
            try {
                trainingService.retrainFromSource();
            } catch (AnalyticsException e) {
                log.error("Startup training failed: {}", e.getMessage());
            }
        }
    }
}
