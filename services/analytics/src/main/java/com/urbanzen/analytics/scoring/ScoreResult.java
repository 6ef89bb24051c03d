package com.urbanzen.analytics.scoring;

/**
 * Score and verdict for one feature vector, tagged with the artifact that produced it.
 */
public record ScoreResult(double score, boolean anomaly, String artifactId) {
}
