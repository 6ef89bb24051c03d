package com.urbanzen.analytics.scoring;

import com.amazon.randomcutforest.RandomCutForest;
import com.amazon.randomcutforest.state.RandomCutForestMapper;
import com.amazon.randomcutforest.state.RandomCutForestState;
import com.urbanzen.analytics.exception.InsufficientDataException;

import java.util.Arrays;

/**
 * {@link OutlierModel} backed by a Random Cut Forest.
 *
 * The raw forest score grows with anomalousness, so the decision value is
 * {@code threshold - score}: the threshold is the training-score quantile at
 * {@code 1 - contamination}, which flags roughly {@code contamination} of the
 * training rows.
 */
public final class RandomCutForestModel implements OutlierModel {

    public static final String TYPE = "random_cut_forest";

    private final RandomCutForest forest;
    private final double threshold;
    private final TrainingSummary trainingSummary;

    private RandomCutForestModel(RandomCutForest forest, double threshold, TrainingSummary trainingSummary) {
        this.forest = forest;
        this.threshold = threshold;
        this.trainingSummary = trainingSummary;
    }

    /**
     * Builds the forest from {@code rows} in order and derives the decision threshold.
     *
     * @throws InsufficientDataException if the forest has not seen enough rows to score
     */
    public static RandomCutForestModel fit(double[][] rows, double contamination, ForestSettings settings) {
        if (contamination <= 0.0 || contamination >= 0.5) {
            throw new IllegalArgumentException("Contamination must be in (0, 0.5): " + contamination);
        }
        int dimensions = rows[0].length;
        int outputAfter = Math.max(1, Math.min(settings.sampleSize() / 4, rows.length / 2));

        RandomCutForest forest = RandomCutForest.builder()
                .dimensions(dimensions)
                .numberOfTrees(settings.numberOfTrees())
                .sampleSize(settings.sampleSize())
                .outputAfter(outputAfter)
                .randomSeed(settings.randomSeed())
                .parallelExecutionEnabled(false)
                .build();

        for (double[] row : rows) {
            forest.update(row);
        }
        if (!forest.isOutputReady()) {
            throw new InsufficientDataException(rows.length, outputAfter);
        }

        double[] scores = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            scores[i] = forest.getAnomalyScore(rows[i]);
        }
        double threshold = quantile(scores, 1.0 - contamination);

        double[] decisions = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            decisions[i] = threshold - scores[i];
        }
        return new RandomCutForestModel(forest, threshold, TrainingSummary.of(decisions));
    }

    /**
     * Restores a persisted forest. The summary is whatever was recorded at fit time and may be null.
     */
    public static RandomCutForestModel fromState(RandomCutForestState state, double threshold,
                                                 TrainingSummary trainingSummary) {
        return new RandomCutForestModel(mapper().toModel(state), threshold, trainingSummary);
    }

    public RandomCutForestState toState() {
        synchronized (this) {
            return mapper().toState(forest);
        }
    }

    public double getThreshold() {
        return threshold;
    }

    public TrainingSummary getTrainingSummary() {
        return trainingSummary;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public int dimensions() {
        return forest.getDimensions();
    }

    // the forest fills its bounding-box cache lazily while scoring
    @Override
    public synchronized double decisionFunction(double[] point) {
        return threshold - forest.getAnomalyScore(point);
    }

    private static RandomCutForestMapper mapper() {
        RandomCutForestMapper mapper = new RandomCutForestMapper();
        mapper.setSaveExecutorContextEnabled(true);
        mapper.setSaveTreeStateEnabled(true);
        return mapper;
    }

    // nearest-rank quantile
    static double quantile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(q * sorted.length);
        int index = Math.min(sorted.length - 1, Math.max(0, rank - 1));
        return sorted[index];
    }
}
