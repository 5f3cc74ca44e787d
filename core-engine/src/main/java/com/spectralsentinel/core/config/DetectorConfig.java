package com.spectralsentinel.core.config;

import com.spectralsentinel.core.detection.GradientMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Hyperparameters of the Spectral Residual detector.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * saliencyWindow: 3         # q
 * scoreWindow: 21           # z
 * threshold: 3.0            # t
 * extrapolationWindow: 5    # m
 * extrapolatedPoints: 5     # k
 * gradientMode: compatible  # or "signed"
 * </pre>
 *
 * <p>
 * Every property has a default, so an empty document is a valid
 * configuration. Call {@link #validate()} after construction /
 * deserialization to verify that all values are legal.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorConfig {

    public static final int DEFAULT_SALIENCY_WINDOW = 3;
    public static final int DEFAULT_SCORE_WINDOW = 21;
    public static final float DEFAULT_THRESHOLD = 3.0f;
    public static final int DEFAULT_EXTRAPOLATION_WINDOW = 5;
    public static final int DEFAULT_EXTRAPOLATED_POINTS = 5;

    /** Window for smoothing the log-amplitude spectrum (q). */
    private int saliencyWindow = DEFAULT_SALIENCY_WINDOW;

    /** Window for the local average of the saliency map (z). */
    private int scoreWindow = DEFAULT_SCORE_WINDOW;

    /** Score above which a point is anomalous (t). */
    private float threshold = DEFAULT_THRESHOLD;

    /** Trailing points used for the extrapolation gradient (m). */
    private int extrapolationWindow = DEFAULT_EXTRAPOLATION_WINDOW;

    /** Points added at each end; 0 disables extrapolation (k). */
    private int extrapolatedPoints = DEFAULT_EXTRAPOLATED_POINTS;

    /** "compatible" or "signed". */
    private String gradientMode = GradientMode.COMPATIBLE.configName();

    /** Configuration with every property at its default. */
    public DetectorConfig() {
    }

    /**
     * Copy constructor.
     *
     * @param other configuration to copy; must not be {@code null}
     */
    public DetectorConfig(DetectorConfig other) {
        Objects.requireNonNull(other, "DetectorConfig must not be null");
        this.saliencyWindow = other.saliencyWindow;
        this.scoreWindow = other.scoreWindow;
        this.threshold = other.threshold;
        this.extrapolationWindow = other.extrapolationWindow;
        this.extrapolatedPoints = other.extrapolatedPoints;
        this.gradientMode = other.gradientMode;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that every hyperparameter holds a legal value.
     *
     * <p>
     * Whether {@code extrapolationWindow} fits the series can only be checked
     * once the series is known; see
     * {@link com.spectralsentinel.core.detection.InsufficientHistoryException}.
     * </p>
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (saliencyWindow < 1) {
            errors.add("'saliencyWindow' must be >= 1, got: " + saliencyWindow);
        }
        if (scoreWindow < 1) {
            errors.add("'scoreWindow' must be >= 1, got: " + scoreWindow);
        }
        if (Float.isNaN(threshold)) {
            errors.add("'threshold' must be a number");
        }
        if (extrapolatedPoints < 0) {
            errors.add("'extrapolatedPoints' must be >= 0, got: " + extrapolatedPoints);
        }
        if (extrapolatedPoints > 0 && extrapolationWindow < 1) {
            errors.add("'extrapolationWindow' must be >= 1 when extrapolation is enabled, got: "
                    + extrapolationWindow);
        }
        try {
            GradientMode.fromName(gradientMode);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorConfig: " + String.join("; ", errors));
        }
    }

    /**
     * @return the configured gradient mode
     * @throws IllegalArgumentException if {@code gradientMode} is unknown
     */
    public GradientMode resolveGradientMode() {
        return GradientMode.fromName(gradientMode);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public int getSaliencyWindow() {
        return saliencyWindow;
    }

    public void setSaliencyWindow(int saliencyWindow) {
        this.saliencyWindow = saliencyWindow;
    }

    public int getScoreWindow() {
        return scoreWindow;
    }

    public void setScoreWindow(int scoreWindow) {
        this.scoreWindow = scoreWindow;
    }

    public float getThreshold() {
        return threshold;
    }

    public void setThreshold(float threshold) {
        this.threshold = threshold;
    }

    public int getExtrapolationWindow() {
        return extrapolationWindow;
    }

    public void setExtrapolationWindow(int extrapolationWindow) {
        this.extrapolationWindow = extrapolationWindow;
    }

    public int getExtrapolatedPoints() {
        return extrapolatedPoints;
    }

    public void setExtrapolatedPoints(int extrapolatedPoints) {
        this.extrapolatedPoints = extrapolatedPoints;
    }

    public String getGradientMode() {
        return gradientMode;
    }

    /**
     * Set the gradient mode, normalised to lowercase.
     *
     * @param gradientMode mode name
     */
    public void setGradientMode(String gradientMode) {
        this.gradientMode = gradientMode != null ? gradientMode.trim().toLowerCase(Locale.ROOT) : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorConfig that))
            return false;
        return saliencyWindow == that.saliencyWindow
                && scoreWindow == that.scoreWindow
                && Float.compare(threshold, that.threshold) == 0
                && extrapolationWindow == that.extrapolationWindow
                && extrapolatedPoints == that.extrapolatedPoints
                && Objects.equals(gradientMode, that.gradientMode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(saliencyWindow, scoreWindow, threshold,
                extrapolationWindow, extrapolatedPoints, gradientMode);
    }

    @Override
    public String toString() {
        return "DetectorConfig{" +
                "q=" + saliencyWindow +
                ", z=" + scoreWindow +
                ", t=" + threshold +
                ", m=" + extrapolationWindow +
                ", k=" + extrapolatedPoints +
                ", gradientMode='" + gradientMode + '\'' +
                '}';
    }
}
