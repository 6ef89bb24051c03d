package com.urbanzen.analytics.training;

import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.artifact.ModelArtifactManager;
import com.urbanzen.analytics.features.DeviceProfileRegistry;
import com.urbanzen.analytics.features.FeatureExtractor;
import com.urbanzen.analytics.features.FeatureVector;
import com.urbanzen.analytics.features.QualityBoundsTable;
import com.urbanzen.analytics.scoring.AnomalyModelTrainer;
import com.urbanzen.analytics.scoring.AnomalyScorer;
import com.urbanzen.analytics.state.DeviceHistory;
import com.urbanzen.analytics.state.InMemoryDeviceStateStore;
import com.urbanzen.common.dto.telemetry.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trains a new artifact from historical telemetry, persists it and makes it active.
 *
 * History is grouped by device and replayed in timestamp order through a
 * private state store, so rolling features match what the live pipeline computes.
 * A failed run leaves the active artifact untouched.
 */
@Slf4j
public class OfflineTrainingService {

    private final DeviceProfileRegistry profiles;
    private final FeatureExtractor extractor;
    private final AnomalyModelTrainer trainer;
    private final ModelArtifactManager artifactManager;
    private final AnomalyScorer scorer;
    private final TelemetryHistorySource historySource;
    private final Path artifactLocation;
    private final Duration lookback;
    private final Clock clock;

    public OfflineTrainingService(DeviceProfileRegistry profiles,
                                  FeatureExtractor extractor,
                                  AnomalyModelTrainer trainer,
                                  ModelArtifactManager artifactManager,
                                  AnomalyScorer scorer,
                                  TelemetryHistorySource historySource,
                                  Path artifactLocation,
                                  Duration lookback,
                                  Clock clock) {
        this.profiles = profiles;
        this.extractor = extractor;
        this.trainer = trainer;
        this.artifactManager = artifactManager;
        this.scorer = scorer;
        this.historySource = historySource;
        this.artifactLocation = artifactLocation;
        this.lookback = lookback;
        this.clock = clock;
    }

    /**
     * Trains on the configured lookback window of the history source.
     */
    public ModelArtifact retrainFromSource() {
        Instant since = clock.instant().minus(lookback);
        return train(historySource.fetchHistory(since));
    }

    /**
     * @throws com.urbanzen.analytics.exception.InsufficientDataException if too few usable events are supplied
     */
    public synchronized ModelArtifact train(Collection<TelemetryEvent> events) {
        List<String> knownDeviceTypes = profiles.knownDeviceTypes();
        QualityBoundsTable qualityBounds = profiles.qualityBounds();

        List<FeatureVector> vectors = buildTrainingVectors(events, knownDeviceTypes, qualityBounds);
        log.info("Training on {} feature vectors from {} events", vectors.size(), events.size());

        ModelArtifact artifact = trainer.fit(vectors, knownDeviceTypes, qualityBounds);
        artifactManager.save(artifact, artifactLocation);
        scorer.activate(artifact);
        return artifact;
    }

    List<FeatureVector> buildTrainingVectors(Collection<TelemetryEvent> events,
                                             List<String> knownDeviceTypes,
                                             QualityBoundsTable qualityBounds) {
        Map<String, List<TelemetryEvent>> byDevice = new LinkedHashMap<>();
        int unusable = 0;
        for (TelemetryEvent event : events) {
            if (event == null || event.deviceId() == null || event.deviceId().isBlank()
                    || event.timestamp() == null) {
                unusable++;
                continue;
            }
            byDevice.computeIfAbsent(event.deviceId(), id -> new ArrayList<>()).add(event);
        }
        if (unusable > 0) {
            log.warn("Ignored {} historical events without device id or timestamp", unusable);
        }

        InMemoryDeviceStateStore replayStore = new InMemoryDeviceStateStore(extractor.windowSize(), clock);
        List<FeatureVector> vectors = new ArrayList<>();
        for (List<TelemetryEvent> deviceEvents : byDevice.values()) {
            deviceEvents.sort(Comparator.comparing(TelemetryEvent::timestamp));
            for (TelemetryEvent event : deviceEvents) {
                DeviceHistory history = replayStore.record(event);
                vectors.add(extractor.extract(event, history, knownDeviceTypes, qualityBounds));
            }
        }
        return vectors;
    }
}
