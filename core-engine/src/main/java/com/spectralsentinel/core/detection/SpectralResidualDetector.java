package com.spectralsentinel.core.detection;

import com.spectralsentinel.core.config.DetectorConfig;
import com.spectralsentinel.core.model.DetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Spectral Residual anomaly detector.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   series (n points)
 *     → Extrapolator      (n + 2k points)
 *     → SaliencyMapper    (n + 2k points)
 *     → trim k per side   (n points)
 *     → Scorer
 *     → Thresholder
 * </pre>
 *
 * <h3>State</h3>
 * <p>
 * This is a <strong>stateless</strong> detector: an instance holds a copy of
 * its configuration and nothing else, and {@link #detect(float[])} is a pure
 * function of the series.
 * </p>
 *
 * @since 1.0.0
 */
public class SpectralResidualDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SpectralResidualDetector.class);

    private final int saliencyWindow;
    private final int scoreWindow;
    private final float threshold;
    private final int extrapolationWindow;
    private final int extrapolatedPoints;
    private final GradientMode gradientMode;

    /**
     * @param config detector configuration
     * @throws NullPointerException  if {@code config} is {@code null}
     * @throws IllegalStateException if {@code config} does not validate
     */
    public SpectralResidualDetector(DetectorConfig config) {
        Objects.requireNonNull(config, "DetectorConfig must not be null");
        config.validate();
        this.saliencyWindow = config.getSaliencyWindow();
        this.scoreWindow = config.getScoreWindow();
        this.threshold = config.getThreshold();
        this.extrapolationWindow = config.getExtrapolationWindow();
        this.extrapolatedPoints = config.getExtrapolatedPoints();
        this.gradientMode = config.resolveGradientMode();
    }

    /**
     * Run the pipeline with explicit hyperparameters and
     * {@link GradientMode#COMPATIBLE} extrapolation.
     *
     * @param data series to evaluate; must not be empty
     * @param q    log-amplitude smoothing window
     * @param z    score averaging window
     * @param t    decision threshold
     * @param m    extrapolation window
     * @param k    extrapolated points per side
     * @return per-point result of length {@code data.length}
     * @throws InsufficientHistoryException if {@code k > 0} and
     *                                      {@code m > data.length}
     */
    public static DetectionResult detect(float[] data, int q, int z, float t, int m, int k) {
        return run(data, q, z, t, m, k, GradientMode.COMPATIBLE);
    }

    @Override
    public DetectionResult detect(float[] series) {
        return run(series, saliencyWindow, scoreWindow, threshold,
                extrapolationWindow, extrapolatedPoints, gradientMode);
    }

    @Override
    public String getName() {
        return "spectral-residual";
    }

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------

    private static DetectionResult run(float[] data, int q, int z, float t, int m, int k, GradientMode mode) {
        Objects.requireNonNull(data, "series must not be null");
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot detect anomalies in an empty series");
        }
        int n = data.length;

        float[] extended = Extrapolator.extrapolate(data, m, k, mode);
        float[] saliency = Arrays.copyOfRange(SaliencyMapper.map(extended, q), k, k + n);
        float[] scores = Scorer.score(saliency, z);
        boolean[] anomalies = Thresholder.flag(scores, t);

        DetectionResult result = new DetectionResult(saliency, scores, anomalies);
        LOG.debug("Evaluated {} point(s) (q={}, z={}, t={}, m={}, k={}): {} anomal(ies)",
                n, q, z, t, m, k, result.anomalyCount());
        return result;
    }

    @Override
    public String toString() {
        return "SpectralResidualDetector{" +
                "q=" + saliencyWindow +
                ", z=" + scoreWindow +
                ", t=" + threshold +
                ", m=" + extrapolationWindow +
                ", k=" + extrapolatedPoints +
                ", gradientMode=" + gradientMode +
                '}';
    }
}
