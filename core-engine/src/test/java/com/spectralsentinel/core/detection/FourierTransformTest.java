package com.spectralsentinel.core.detection;

import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FourierTransform}.
 */
class FourierTransformTest {

    private static final double TOLERANCE = 1e-9;

    @ParameterizedTest(name = "n={0}")
    @ValueSource(ints = {1, 2, 3, 5, 6, 7, 8, 12, 15, 16, 17, 31})
    @DisplayName("Should match a direct DFT for power-of-two and other lengths")
    void shouldMatchDirectTransform(int n) {
        Complex[] input = randomSignal(n, n);

        Complex[] actual = FourierTransform.forward(input);
        Complex[] expected = directTransform(input, -1);

        assertClose(actual, expected, TOLERANCE * n);
    }

    @ParameterizedTest(name = "n={0}")
    @ValueSource(ints = {1, 4, 5, 9, 13, 64})
    @DisplayName("Should leave the inverse transform unnormalised")
    void shouldNotScaleInverse(int n) {
        Complex[] input = randomSignal(n, 100 + n);

        Complex[] roundTrip = FourierTransform.inverse(FourierTransform.forward(input));

        Complex[] scaled = new Complex[n];
        for (int i = 0; i < n; i++) {
            scaled[i] = input[i].multiply(n);
        }
        assertClose(roundTrip, scaled, TOLERANCE * n * n);
    }

    @Test
    @DisplayName("Should compute the spectrum of a short ramp")
    void shouldTransformRamp() {
        Complex[] ramp = real(1, 2, 3, 4, 5);

        Complex[] spectrum = FourierTransform.forward(ramp);

        // DC bin is the sum; every other bin of a ramp is -n/2 + i(n/2)cot(pi k/n)
        assertThat(spectrum[0].getReal()).isCloseTo(15.0, within(TOLERANCE));
        assertThat(spectrum[0].getImaginary()).isCloseTo(0.0, within(TOLERANCE));
        for (int k = 1; k < 5; k++) {
            assertThat(spectrum[k].getReal()).isCloseTo(-2.5, within(1e-9));
            assertThat(spectrum[k].getImaginary())
                    .isCloseTo(2.5 / Math.tan(Math.PI * k / 5), within(1e-9));
        }
    }

    @Test
    @DisplayName("Should reject an empty sequence")
    void shouldRejectEmptyInput() {
        assertThatThrownBy(() -> FourierTransform.forward(new Complex[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("empty");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Complex[] directTransform(Complex[] x, int sign) {
        int n = x.length;
        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) {
            double re = 0;
            double im = 0;
            for (int j = 0; j < n; j++) {
                double angle = sign * 2 * Math.PI * ((long) j * k % n) / n;
                double c = Math.cos(angle);
                double s = Math.sin(angle);
                re += x[j].getReal() * c - x[j].getImaginary() * s;
                im += x[j].getReal() * s + x[j].getImaginary() * c;
            }
            out[k] = new Complex(re, im);
        }
        return out;
    }

    private static Complex[] randomSignal(int n, long seed) {
        Random random = new Random(seed);
        Complex[] signal = new Complex[n];
        for (int i = 0; i < n; i++) {
            signal[i] = new Complex(random.nextDouble() * 10 - 5, random.nextDouble() * 10 - 5);
        }
        return signal;
    }

    private static Complex[] real(double... values) {
        Complex[] signal = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            signal[i] = new Complex(values[i], 0);
        }
        return signal;
    }

    private static void assertClose(Complex[] actual, Complex[] expected, double tolerance) {
        assertThat(actual).hasSameSizeAs(expected);
        for (int i = 0; i < expected.length; i++) {
            assertThat(actual[i].getReal())
                    .as("real part of bin %d", i)
                    .isCloseTo(expected[i].getReal(), within(tolerance));
            assertThat(actual[i].getImaginary())
                    .as("imaginary part of bin %d", i)
                    .isCloseTo(expected[i].getImaginary(), within(tolerance));
        }
    }
}
