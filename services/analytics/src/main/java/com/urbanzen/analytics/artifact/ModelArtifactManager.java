package com.urbanzen.analytics.artifact;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urbanzen.analytics.exception.AnalyticsException;
import com.urbanzen.analytics.exception.ArtifactCorruptException;
import com.urbanzen.analytics.scoring.RandomCutForestModel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Persists and restores {@link ModelArtifact}s as JSON documents.
 *
 * Saves go to a temporary sibling file that is then moved over the target, so
 * readers never observe a half-written artifact.
 */
@Slf4j
public class ModelArtifactManager {

    private final ObjectMapper objectMapper;

    public ModelArtifactManager(ObjectMapper objectMapper) {
        // a truncated or concatenated write must not load as a valid artifact
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public void save(ModelArtifact artifact, Path location) {
        if (!(artifact.model() instanceof RandomCutForestModel forest)) {
            throw new IllegalArgumentException("Unsupported model type: " + artifact.model().type());
        }
        ArtifactDocument document = new ArtifactDocument(
                ArtifactDocument.CURRENT_FORMAT,
                artifact.artifactId(),
                artifact.createdAt(),
                artifact.contamination(),
                artifact.featureColumns(),
                artifact.knownDeviceTypes(),
                artifact.qualityBounds(),
                artifact.normalizer(),
                new ArtifactDocument.ModelSection(forest.type(), forest.getThreshold(), forest.toState()),
                artifact.trainingSummary());

        Path target = location.toAbsolutePath();
        Path temp = null;
        try {
            Path directory = target.getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), document);
            moveIntoPlace(temp, target);
            log.info("Saved model artifact {} to {}", artifact.artifactId(), target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new AnalyticsException("Failed to save model artifact to " + target, e);
        }
    }

    /**
     * @throws ArtifactCorruptException if the document is missing, unreadable or inconsistent
     */
    public ModelArtifact load(Path location) {
        String where = location.toString();
        ArtifactDocument document;
        try {
            document = objectMapper.readValue(location.toFile(), ArtifactDocument.class);
        } catch (IOException | RuntimeException e) {
            if (!Files.exists(location)) {
                throw new ArtifactCorruptException(where, "file not found", e);
            }
            throw new ArtifactCorruptException(where, "unreadable document", e);
        }

        if (document == null) {
            throw new ArtifactCorruptException(where, "empty document");
        }
        if (document.formatVersion() != ArtifactDocument.CURRENT_FORMAT) {
            throw new ArtifactCorruptException(where, "unsupported format version " + document.formatVersion());
        }
        if (document.featureColumns() == null || document.featureColumns().isEmpty()) {
            throw new ArtifactCorruptException(where, "feature column list is missing");
        }
        if (document.normalizer() == null) {
            throw new ArtifactCorruptException(where, "normalizer is missing");
        }
        ArtifactDocument.ModelSection section = document.model();
        if (section == null || section.forest() == null) {
            throw new ArtifactCorruptException(where, "model state is missing");
        }
        if (!RandomCutForestModel.TYPE.equals(section.type())) {
            throw new ArtifactCorruptException(where, "unknown model type " + section.type());
        }

        try {
            RandomCutForestModel model = RandomCutForestModel.fromState(
                    section.forest(), section.threshold(), document.training());
            ModelArtifact artifact = new ModelArtifact(
                    document.artifactId(),
                    document.createdAt(),
                    document.contamination(),
                    document.featureColumns(),
                    document.knownDeviceTypes(),
                    document.qualityBounds(),
                    document.normalizer(),
                    model,
                    document.training());
            log.info("Loaded model artifact {} from {}", artifact.artifactId(), where);
            return artifact;
        } catch (RuntimeException e) {
            throw new ArtifactCorruptException(where, e.getMessage(), e);
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temporary artifact file {}: {}", temp, e.getMessage());
        }
    }
}
