package com.urbanzen.analytics.scoring;

/**
 * Trained unsupervised model evaluated on normalized feature rows.
 *
 * Implementations are read-only once trained and safe to share across threads.
 */
public interface OutlierModel {

    /**
     * Identifier written to the artifact so the model can be restored.
     */
    String type();

    int dimensions();

    /**
     * Signed distance from the model's decision threshold. Lower is more
     * anomalous; values below zero are anomalies.
     */
    double decisionFunction(double[] point);
}
