package com.urbanzen.analytics.scoring;

import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.exception.InsufficientDataException;
import com.urbanzen.analytics.features.FeatureVector;
import com.urbanzen.analytics.features.QualityBoundsTable;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Fits a new {@link ModelArtifact} from historical feature vectors. Offline only.
 */
@Slf4j
public class AnomalyModelTrainer {

    private final double contamination;
    private final ForestSettings forestSettings;
    private final int minTrainingSamples;
    private final Clock clock;

    public AnomalyModelTrainer(double contamination, ForestSettings forestSettings,
                               int minTrainingSamples, Clock clock) {
        this.contamination = contamination;
        this.forestSettings = forestSettings;
        this.minTrainingSamples = Math.max(1, minTrainingSamples);
        this.clock = clock;
    }

    /**
     * Fits normalizer and model on {@code vectors}. The schema is the union of
     * the vectors' columns in first-seen order.
     *
     * @throws InsufficientDataException if fewer than the minimum sample count is supplied
     */
    public ModelArtifact fit(List<FeatureVector> vectors, List<String> knownDeviceTypes,
                             QualityBoundsTable qualityBounds) {
        if (vectors.size() < minTrainingSamples) {
            throw new InsufficientDataException(vectors.size(), minTrainingSamples);
        }

        List<String> columns = schemaOf(vectors);
        double[][] rows = new double[vectors.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = vectors.get(i).toArray(columns);
        }

        StandardNormalizer normalizer = StandardNormalizer.fit(rows);
        double[][] normalized = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            normalized[i] = normalizer.transform(rows[i]);
        }

        long started = System.nanoTime();
        RandomCutForestModel model = RandomCutForestModel.fit(normalized, contamination, forestSettings);
        TrainingSummary summary = model.getTrainingSummary();
        log.info("Trained forest on {} samples x {} features in {} ms, threshold={}, anomalyRatio={}, "
                        + "meanScore={}, stdScore={}",
                rows.length, columns.size(), (System.nanoTime() - started) / 1_000_000, model.getThreshold(),
                summary.anomalyRatio(), summary.meanScore(), summary.stdScore());

        return new ModelArtifact(
                UUID.randomUUID().toString(),
                clock.instant(),
                contamination,
                columns,
                knownDeviceTypes,
                qualityBounds,
                normalizer,
                model,
                summary);
    }

    private static List<String> schemaOf(List<FeatureVector> vectors) {
        Set<String> columns = new LinkedHashSet<>();
        for (FeatureVector vector : vectors) {
            columns.addAll(vector.asMap().keySet());
        }
        return new ArrayList<>(columns);
    }
}
