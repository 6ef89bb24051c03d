package com.urbanzen.analytics.artifact;

import com.amazon.randomcutforest.state.RandomCutForestState;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.urbanzen.analytics.features.QualityBoundsTable;
import com.urbanzen.analytics.scoring.StandardNormalizer;
import com.urbanzen.analytics.scoring.TrainingSummary;

import java.time.Instant;
import java.util.List;

/**
 * On-disk JSON layout of a {@link ModelArtifact}.
 */
record ArtifactDocument(
    @JsonProperty("formatVersion") int formatVersion,
    @JsonProperty("artifactId") String artifactId,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("contamination") double contamination,
    @JsonProperty("featureColumns") List<String> featureColumns,
    @JsonProperty("knownDeviceTypes") List<String> knownDeviceTypes,
    @JsonProperty("qualityBounds") QualityBoundsTable qualityBounds,
    @JsonProperty("normalizer") StandardNormalizer normalizer,
    @JsonProperty("model") ModelSection model,
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("training") TrainingSummary training
) {
    // 2: quality bounds per device type, training summary
    static final int CURRENT_FORMAT = 2;

    record ModelSection(
        @JsonProperty("type") String type,
        @JsonProperty("threshold") double threshold,
        @JsonProperty("forest") RandomCutForestState forest
    ) {
    }
}
