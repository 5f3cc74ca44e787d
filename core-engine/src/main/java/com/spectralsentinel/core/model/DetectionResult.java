package com.spectralsentinel.core.model;

import java.util.Arrays;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Output of a single detection run.
 *
 * <p>
 * Holds three index-aligned sequences, each exactly as long as the input
 * series: the saliency map, the anomaly score and the anomaly flag of every
 * point.
 * </p>
 *
 * <h3>Immutability</h3>
 * <p>
 * Arrays are copied on the way in and on the way out, so a result can be
 * shared freely between threads once constructed.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionResult {

    private final float[] saliency;
    private final float[] scores;
    private final boolean[] anomalies;

    /**
     * @param saliency  saliency value per point
     * @param scores    anomaly score per point
     * @param anomalies anomaly flag per point
     * @throws NullPointerException     if any array is {@code null}
     * @throws IllegalArgumentException if the arrays differ in length
     */
    public DetectionResult(float[] saliency, float[] scores, boolean[] anomalies) {
        Objects.requireNonNull(saliency, "saliency must not be null");
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(anomalies, "anomalies must not be null");

        if (saliency.length != scores.length || saliency.length != anomalies.length) {
            throw new IllegalArgumentException(String.format(
                    "Result sequences must share one length, got saliency=%d scores=%d anomalies=%d",
                    saliency.length, scores.length, anomalies.length));
        }
        this.saliency = saliency.clone();
        this.scores = scores.clone();
        this.anomalies = anomalies.clone();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    /**
     * @return number of points covered by this result
     */
    public int size() {
        return saliency.length;
    }

    /**
     * @return copy of the saliency map
     */
    public float[] getSaliency() {
        return saliency.clone();
    }

    /**
     * @return copy of the per-point scores
     */
    public float[] getScores() {
        return scores.clone();
    }

    /**
     * @return copy of the per-point anomaly flags
     */
    public boolean[] getAnomalies() {
        return anomalies.clone();
    }

    public float saliencyAt(int index) {
        return saliency[index];
    }

    public float scoreAt(int index) {
        return scores[index];
    }

    public boolean isAnomaly(int index) {
        return anomalies[index];
    }

    /**
     * @return number of points flagged as anomalous
     */
    public int anomalyCount() {
        int count = 0;
        for (boolean anomaly : anomalies) {
            if (anomaly) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return indices of the flagged points, in ascending order
     */
    public int[] anomalyIndices() {
        return IntStream.range(0, anomalies.length)
                .filter(i -> anomalies[i])
                .toArray();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionResult that))
            return false;
        return Arrays.equals(saliency, that.saliency)
                && Arrays.equals(scores, that.scores)
                && Arrays.equals(anomalies, that.anomalies);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(saliency);
        result = 31 * result + Arrays.hashCode(scores);
        result = 31 * result + Arrays.hashCode(anomalies);
        return result;
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "size=" + size() +
                ", anomalies=" + anomalyCount() +
                '}';
    }
}
