package com.spectralsentinel.core.detection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;

/**
 * Pads a series at both ends with a value estimated from its trailing window.
 *
 * <p>
 * The Fourier transform treats the series as periodic, so an abrupt jump
 * between the last and the first point shows up as spurious saliency near the
 * edges. Padding with {@code k} copies of an estimated next value on each side
 * moves those artifacts into the padding, which the detector trims away.
 * </p>
 *
 * <h3>Estimate</h3>
 * <p>
 * With {@code last = n - 1}, the average gradient {@code g} is taken over the
 * pairs formed by {@code last} and every index {@code i} in
 * {@code [last - m, last)}, and the padding value is
 * {@code data[last - m + 1] + g * m}. How the index distance of a pair is
 * measured is controlled by {@link GradientMode}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Extrapolator {

    private static final Logger LOG = LoggerFactory.getLogger(Extrapolator.class);

    private Extrapolator() {
        // utility class — not instantiable
    }

    /**
     * Extrapolate using {@link GradientMode#COMPATIBLE}.
     *
     * @see #extrapolate(float[], int, int, GradientMode)
     */
    public static float[] extrapolate(float[] data, int m, int k) {
        return extrapolate(data, m, k, GradientMode.COMPATIBLE);
    }

    /**
     * Extend {@code data} by {@code k} estimated points at each end.
     *
     * @param data series to extend; must not be {@code null}
     * @param m    number of trailing points used for the gradient estimate
     * @param k    number of points added at each end; {@code 0} returns a copy
     *             of {@code data} without checking {@code m}
     * @param mode index-distance policy; must not be {@code null}
     * @return series of length {@code data.length + 2k}
     * @throws InsufficientHistoryException if {@code k > 0} and
     *                                      {@code m > data.length}
     * @throws IllegalArgumentException     if {@code k < 0}, or {@code k > 0}
     *                                      and {@code m < 1}, or the padded
     *                                      length does not fit an {@code int}
     */
    public static float[] extrapolate(float[] data, int m, int k, GradientMode mode) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(mode, "GradientMode must not be null");
        if (k < 0) {
            throw new IllegalArgumentException("Number of extrapolated points must be >= 0, got: " + k);
        }
        if (k == 0) {
            return data.clone();
        }
        if (m < 1) {
            throw new IllegalArgumentException("Extrapolation window must be >= 1, got: " + m);
        }
        if (m > data.length) {
            throw new InsufficientHistoryException(m, data.length);
        }

        int extendedLength;
        try {
            extendedLength = Math.addExact(data.length, Math.multiplyExact(2, k));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Cannot extrapolate " + k + " points per side of a "
                    + data.length + "-point series: padded length exceeds " + Integer.MAX_VALUE, e);
        }

        int last = data.length - 1;
        float g = mode == GradientMode.SIGNED
                ? signedGradient(data, last, m)
                : wrappingGradient(data, last, m);
        float extra = data[last - m + 1] + g * m;

        LOG.debug("Extrapolating {} point(s) per side: g={} extra={} (mode={})", k, g, extra, mode);

        float[] extended = new float[extendedLength];
        Arrays.fill(extended, 0, k, extra);
        System.arraycopy(data, 0, extended, k, data.length);
        Arrays.fill(extended, k + data.length, extended.length, extra);
        return extended;
    }

    // ---------------------------------------------------------------
    // Gradient estimates
    // ---------------------------------------------------------------

    private static float wrappingGradient(float[] data, int last, int m) {
        // A negative start wraps past the end of the index space: no pairs.
        float sum = 0f;
        int start = last - m;
        if (start >= 0) {
            for (int i = start; i < last; i++) {
                sum += (data[i] - data[last]) / unsignedToFloat((long) i - last);
            }
        }
        return sum / m;
    }

    private static float signedGradient(float[] data, int last, int m) {
        int start = Math.max(0, last - m);
        int pairs = last - start;
        if (pairs == 0) {
            return 0f;
        }
        float sum = 0f;
        for (int i = start; i < last; i++) {
            sum += (data[i] - data[last]) / (float) (i - last);
        }
        return sum / pairs;
    }

    /**
     * Convert a 64-bit value, read as unsigned, to the nearest float.
     */
    static float unsignedToFloat(long value) {
        if (value >= 0) {
            return (float) value;
        }
        // halve (keeping the sticky bit for correct rounding), convert, double
        return (float) ((value >>> 1) | (value & 1L)) * 2f;
    }
}
