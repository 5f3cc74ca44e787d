package com.spectralsentinel.core.detection;

import java.util.Objects;

/**
 * Turns scores into anomaly flags.
 *
 * <p>
 * A point is anomalous when its score is <em>strictly</em> greater than the
 * threshold. {@code NaN} never compares greater, so an undefined score is
 * never flagged; {@code +Infinity} exceeds every finite threshold.
 * </p>
 *
 * @since 1.0.0
 */
public final class Thresholder {

    private Thresholder() {
        // utility class — not instantiable
    }

    /**
     * @param scores    per-point scores; must not be {@code null}
     * @param threshold decision threshold
     * @return one flag per score
     */
    public static boolean[] flag(float[] scores, float threshold) {
        Objects.requireNonNull(scores, "scores must not be null");
        boolean[] flags = new boolean[scores.length];
        for (int i = 0; i < scores.length; i++) {
            flags[i] = scores[i] > threshold;
        }
        return flags;
    }
}
