package com.urbanzen.analytics.scoring;

import com.urbanzen.analytics.artifact.ModelArtifact;
import com.urbanzen.analytics.exception.ModelNotReadyException;
import com.urbanzen.analytics.features.FeatureVector;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scores feature vectors against the active model artifact.
 *
 * The active artifact is swapped wholesale by {@link #activate}. Callers that
 * need the same artifact for extraction and scoring read it once with
 * {@link #requireArtifact()} and pass it to {@link #score(FeatureVector, ModelArtifact)}.
 */
@Slf4j
public class AnomalyScorer {

    private final AtomicReference<ModelArtifact> active = new AtomicReference<>();

    /**
     * Scores against whichever artifact is active at call time.
     *
     * @throws ModelNotReadyException if no artifact has been activated
     */
    public ScoreResult score(FeatureVector vector) {
        return score(vector, requireArtifact());
    }

    /**
     * Aligns {@code vector} to the artifact's columns, normalizes it and
     * evaluates the model's decision function.
     */
    public ScoreResult score(FeatureVector vector, ModelArtifact artifact) {
        double[] aligned = vector.toArray(artifact.featureColumns());
        double[] normalized = artifact.normalizer().transform(aligned);
        double decision = artifact.model().decisionFunction(normalized);
        return new ScoreResult(decision, decision < 0.0, artifact.artifactId());
    }

    public ModelArtifact requireArtifact() {
        ModelArtifact artifact = active.get();
        if (artifact == null) {
            throw new ModelNotReadyException();
        }
        return artifact;
    }

    public Optional<ModelArtifact> activeArtifact() {
        return Optional.ofNullable(active.get());
    }

    /**
     * Makes {@code artifact} the active one.
     *
     * @return the previously active artifact, if any
     */
    public Optional<ModelArtifact> activate(ModelArtifact artifact) {
        ModelArtifact previous = active.getAndSet(artifact);
        log.info("Activated model artifact {} ({} features, created {})",
                artifact.artifactId(), artifact.dimensions(), artifact.createdAt());
        return Optional.ofNullable(previous);
    }

    public boolean isReady() {
        return active.get() != null;
    }
}
