package com.urbanzen.analytics.artifact;

import com.urbanzen.analytics.features.QualityBoundsTable;
import com.urbanzen.analytics.scoring.OutlierModel;
import com.urbanzen.analytics.scoring.StandardNormalizer;
import com.urbanzen.analytics.scoring.TrainingSummary;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A trained scorer bundled with the feature schema and normalization it was
 * trained with. Immutable; retraining produces a new artifact.
 *
 * @param featureColumns   ordered column set every scored vector is aligned to
 * @param knownDeviceTypes device types one-hot encoded at training time, in column order
 * @param qualityBounds    min-max bounds applied to quality fields at training time, per device type
 * @param trainingSummary  decision-value statistics of the training set; null for artifacts that never recorded one
 */
public record ModelArtifact(
    String artifactId,
    Instant createdAt,
    double contamination,
    List<String> featureColumns,
    List<String> knownDeviceTypes,
    QualityBoundsTable qualityBounds,
    StandardNormalizer normalizer,
    OutlierModel model,
    TrainingSummary trainingSummary
) {
    public ModelArtifact {
        Objects.requireNonNull(artifactId, "artifactId");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(normalizer, "normalizer");
        Objects.requireNonNull(model, "model");
        if (featureColumns == null || featureColumns.isEmpty()) {
            throw new IllegalArgumentException("Artifact needs a non-empty feature column list");
        }
        featureColumns = List.copyOf(featureColumns);
        knownDeviceTypes = knownDeviceTypes != null ? List.copyOf(knownDeviceTypes) : List.of();
        qualityBounds = qualityBounds != null ? qualityBounds : QualityBoundsTable.empty();
        if (normalizer.dimensions() != featureColumns.size()) {
            throw new IllegalArgumentException("Normalizer has " + normalizer.dimensions()
                    + " columns but the schema has " + featureColumns.size());
        }
        if (model.dimensions() != featureColumns.size()) {
            throw new IllegalArgumentException("Model expects " + model.dimensions()
                    + " dimensions but the schema has " + featureColumns.size());
        }
    }

    public int dimensions() {
        return featureColumns.size();
    }

    public Optional<TrainingSummary> training() {
        return Optional.ofNullable(trainingSummary);
    }
}
