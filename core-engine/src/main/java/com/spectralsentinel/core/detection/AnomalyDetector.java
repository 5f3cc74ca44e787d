package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.model.DetectionResult;

/**
 * Contract for batch anomaly detectors.
 * <p>
 * A detector receives the complete, buffered series and returns one
 * saliency value, score and flag per point. Implementations hold only their
 * configuration, so one instance may serve many series and many threads.
 * </p>
 */
public interface AnomalyDetector {

    /**
     * Evaluate a whole series.
     *
     * @param series the values in time order; must not be empty
     * @return per-point result, index-aligned with {@code series}
     */
    DetectionResult detect(float[] series);

    /**
     * @return short name of the detection method
     */
    String getName();
}
