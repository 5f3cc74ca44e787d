package com.spectralsentinel.core.detection;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Discrete Fourier transform of arbitrary length.
 *
 * <p>
 * Power-of-two lengths go straight to the commons-math radix-2
 * {@link FastFourierTransformer}. Any other length is rewritten as a circular
 * convolution with a chirp sequence (Bluestein's algorithm) and evaluated with
 * power-of-two transforms of length at least {@code 2n - 1}.
 * </p>
 *
 * <h3>Conventions</h3>
 * <ul>
 * <li>{@link #forward(Complex[])}: {@code X[k] = sum x[j] exp(-2 pi i jk/n)}</li>
 * <li>{@link #inverse(Complex[])}: {@code x[j] = sum X[k] exp(+2 pi i jk/n)},
 * <strong>not</strong> divided by {@code n}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class FourierTransform {

    private static final FastFourierTransformer RADIX2 = new FastFourierTransformer(DftNormalization.STANDARD);

    private FourierTransform() {
        // utility class — not instantiable
    }

    /**
     * Forward transform.
     *
     * @param input time-domain samples; must not be {@code null} or empty
     * @return frequency-domain samples, same length as {@code input}
     * @throws IllegalArgumentException if {@code input} is empty
     */
    public static Complex[] forward(Complex[] input) {
        Objects.requireNonNull(input, "input must not be null");
        if (input.length == 0) {
            throw new IllegalArgumentException("Cannot transform an empty sequence");
        }
        if (ArithmeticUtils.isPowerOfTwo(input.length)) {
            return RADIX2.transform(input, TransformType.FORWARD);
        }
        return bluestein(input);
    }

    /**
     * Unnormalised inverse transform, so that
     * {@code inverse(forward(x)) == n * x}.
     *
     * @param input frequency-domain samples; must not be {@code null} or empty
     * @return time-domain samples, same length as {@code input}
     * @throws IllegalArgumentException if {@code input} is empty
     */
    public static Complex[] inverse(Complex[] input) {
        Objects.requireNonNull(input, "input must not be null");
        // conj(F(conj(x))) flips the sign of the exponent without scaling
        return conjugate(forward(conjugate(input)));
    }

    // ---------------------------------------------------------------
    // Bluestein
    // ---------------------------------------------------------------

    private static Complex[] bluestein(Complex[] input) {
        int n = input.length;
        int size = nextPowerOfTwo(2 * n - 1);

        // w[j] = exp(-pi i j^2 / n); j^2 is reduced mod 2n to keep the angle small
        Complex[] chirp = new Complex[n];
        long period = 2L * n;
        for (int j = 0; j < n; j++) {
            double angle = Math.PI * (((long) j * j) % period) / n;
            chirp[j] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = zeros(size);
        for (int j = 0; j < n; j++) {
            a[j] = input[j].multiply(chirp[j]);
        }

        Complex[] b = zeros(size);
        b[0] = chirp[0].conjugate();
        for (int j = 1; j < n; j++) {
            Complex c = chirp[j].conjugate();
            b[j] = c;
            b[size - j] = c;
        }

        Complex[] fa = RADIX2.transform(a, TransformType.FORWARD);
        Complex[] fb = RADIX2.transform(b, TransformType.FORWARD);
        Complex[] product = new Complex[size];
        for (int i = 0; i < size; i++) {
            product[i] = fa[i].multiply(fb[i]);
        }
        // STANDARD normalisation divides the inverse by size, as the convolution needs
        Complex[] convolved = RADIX2.transform(product, TransformType.INVERSE);

        Complex[] output = new Complex[n];
        for (int k = 0; k < n; k++) {
            output[k] = convolved[k].multiply(chirp[k]);
        }
        return output;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static int nextPowerOfTwo(int value) {
        int power = Integer.highestOneBit(value);
        return power == value ? power : power << 1;
    }

    private static Complex[] zeros(int size) {
        Complex[] zeros = new Complex[size];
        Arrays.fill(zeros, Complex.ZERO);
        return zeros;
    }

    private static Complex[] conjugate(Complex[] values) {
        Complex[] conjugated = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            conjugated[i] = values[i].conjugate();
        }
        return conjugated;
    }
}
