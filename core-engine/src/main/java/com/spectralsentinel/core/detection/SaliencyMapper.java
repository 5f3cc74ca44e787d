package com.spectralsentinel.core.detection;

import org.apache.commons.math3.complex.Complex;

import java.util.Objects;

/**
 * Computes the spectral-residual saliency map of a series.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Forward DFT of the series, each bin divided by the series length.</li>
 * <li>Amplitude and phase per bin; {@code logAmp = ln(amplitude)}.</li>
 * <li>Spectral residual: {@code logAmp} minus its moving average over
 * {@code q} bins (see {@link Convolver}).</li>
 * <li>Per bin, the complex number with polar coordinates
 * {@code (residual, phase)} is passed through the complex exponential.</li>
 * <li>Unnormalised inverse DFT; the saliency map is the magnitude of every
 * sample.</li>
 * </ol>
 *
 * <p>
 * Non-finite intermediates (a zero amplitude gives {@code ln 0 = -Infinity})
 * are not corrected; they propagate into the map.
 * </p>
 *
 * @since 1.0.0
 */
public final class SaliencyMapper {

    private SaliencyMapper() {
        // utility class — not instantiable
    }

    /**
     * @param data series to map; must not be {@code null} or empty
     * @param q    smoothing window for the log-amplitude spectrum; {@code >= 1}
     * @return non-negative saliency per point, same length as {@code data}
     * @throws IllegalArgumentException if {@code data} is empty or {@code q < 1}
     */
    public static float[] map(float[] data, int q) {
        Objects.requireNonNull(data, "data must not be null");
        int n = data.length;

        Complex[] signal = new Complex[n];
        for (int i = 0; i < n; i++) {
            signal[i] = new Complex(data[i], 0.0);
        }
        Complex[] spectrum = FourierTransform.forward(signal);

        float[] logAmplitude = new float[n];
        float[] phase = new float[n];
        for (int i = 0; i < n; i++) {
            Complex scaled = spectrum[i].multiply(1.0 / n);
            logAmplitude[i] = (float) Math.log((float) scaled.abs());
            phase[i] = (float) scaled.getArgument();
        }

        float[] averageLogAmplitude = Convolver.convolve(logAmplitude, q);

        Complex[] reconstructed = new Complex[n];
        for (int i = 0; i < n; i++) {
            float residual = logAmplitude[i] - averageLogAmplitude[i];
            reconstructed[i] = reconstruct(residual, phase[i]);
        }

        Complex[] restored = FourierTransform.inverse(reconstructed);
        float[] saliency = new float[n];
        for (int i = 0; i < n; i++) {
            saliency[i] = (float) restored[i].abs();
        }
        return saliency;
    }

    /**
     * {@code exp(r cos(theta) + i r sin(theta))}.
     *
     * <p>
     * Not the same as {@code exp(r) * exp(i theta)}: the phase enters the
     * exponent together with the residual.
     * </p>
     *
     * @param residual radius of the polar number (may be negative)
     * @param phase    angle in radians
     * @return complex exponential of the polar number
     */
    static Complex reconstruct(double residual, double phase) {
        // ComplexUtils.polar2Complex rejects a negative radius
        Complex polar = new Complex(residual * Math.cos(phase), residual * Math.sin(phase));
        return polar.exp();
    }
}
