package com.spectralsentinel.core.detection;

import java.util.Objects;

/**
 * Scores each saliency value against its local average.
 *
 * <p>
 * {@code score[i] = (saliency[i] - avg[i]) / avg[i]}, where {@code avg} is the
 * {@link Convolver} average of the saliency map over {@code z} points. A zero
 * local average yields {@code NaN} or an infinity, which is returned as is.
 * </p>
 *
 * @since 1.0.0
 */
public final class Scorer {

    private Scorer() {
        // utility class — not instantiable
    }

    /**
     * @param saliency saliency map; must not be {@code null}
     * @param z        averaging window; {@code >= 1}
     * @return score per point, same length as {@code saliency}
     * @throws IllegalArgumentException if {@code z < 1}
     */
    public static float[] score(float[] saliency, int z) {
        Objects.requireNonNull(saliency, "saliency must not be null");
        float[] average = Convolver.convolve(saliency, z);

        float[] scores = new float[saliency.length];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = (saliency[i] - average[i]) / average[i];
        }
        return scores;
    }
}
