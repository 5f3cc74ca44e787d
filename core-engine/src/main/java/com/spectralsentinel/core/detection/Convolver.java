package com.spectralsentinel.core.detection;

import java.util.Objects;

/**
 * Fixed-window moving average with zero padding.
 *
 * <p>
 * The input is padded with {@code lp} zeros on the left and {@code rp} zeros
 * on the right, where {@code lp = w/2 - 1} for an even window and
 * {@code lp = (w-1)/2} for an odd one, and {@code rp = w - lp - 1}. A window
 * of size {@code w} then slides across the padded sequence with stride 1, so
 * the output has the same length as the input.
 * </p>
 *
 * <p>
 * Padding with zeros (rather than replicating the edges) pulls the averages
 * near both ends toward zero. Saliency and score values depend on that bias.
 * </p>
 *
 * @since 1.0.0
 */
public final class Convolver {

    private Convolver() {
        // utility class — not instantiable
    }

    /**
     * Average {@code data} over a sliding window of size {@code w}.
     *
     * @param data input sequence; must not be {@code null}
     * @param w    window size; must be {@code >= 1}
     * @return averaged sequence, same length as {@code data}
     * @throws NullPointerException     if {@code data} is {@code null}
     * @throws IllegalArgumentException if {@code w < 1}
     */
    public static float[] convolve(float[] data, int w) {
        Objects.requireNonNull(data, "data must not be null");
        if (w < 1) {
            throw new IllegalArgumentException("Window size must be >= 1, got: " + w);
        }

        int lp = w % 2 == 0 ? w / 2 - 1 : (w - 1) / 2;
        int rp = w - lp - 1;

        float[] padded = new float[lp + data.length + rp];
        System.arraycopy(data, 0, padded, lp, data.length);

        float[] averaged = new float[data.length];
        for (int start = 0; start < averaged.length; start++) {
            float sum = 0f;
            for (int j = start; j < start + w; j++) {
                sum += padded[j];
            }
            averaged[start] = sum / w;
        }
        return averaged;
    }
}
