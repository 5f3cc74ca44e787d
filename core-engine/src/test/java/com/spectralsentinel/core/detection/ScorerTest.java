package com.spectralsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Scorer}.
 */
class ScorerTest {

    @Test
    @DisplayName("Should score each value against its zero-padded local average")
    void shouldScoreAgainstLocalAverage() {
        // average over 3 = [1, 2, 3, 4, 3]
        float[] scores = Scorer.score(new float[] {1f, 2f, 3f, 4f, 5f}, 3);

        assertThat(scores).containsExactly(
                new float[] {0f, 0f, 0f, 0f, 2f / 3f}, within(1e-6f));
    }

    @Test
    @DisplayName("Should give a sharp spike a large score")
    void shouldScoreSpikeHighly() {
        float[] saliency = {1f, 1f, 1f, 1f, 10f, 1f, 1f, 1f, 1f};

        float[] scores = Scorer.score(saliency, 3);

        // avg at the spike = 12 / 3 = 4 -> (10 - 4) / 4
        assertThat(scores[4]).isCloseTo(1.5f, within(1e-6f));
        assertThat(scores[3]).isLessThan(0f);
    }

    @Test
    @DisplayName("Should yield NaN, not a default, when the local average is zero")
    void shouldLetZeroOverZeroFlow() {
        float[] scores = Scorer.score(new float[] {1f, 0f, 0f, 0f, 0f}, 3);

        assertThat(scores[0]).isCloseTo(2f, within(1e-6f));
        assertThat(scores[1]).isCloseTo(-1f, within(1e-6f));
        assertThat(scores[2]).isNaN();
        assertThat(scores[3]).isNaN();
    }

    @Test
    @DisplayName("Should yield +Infinity for a positive value over a zero average")
    void shouldLetInfinityFlow() {
        // window 2 pads only on the right: averages [0, -1.5]
        float[] scores = Scorer.score(new float[] {3f, -3f}, 2);

        assertThat(scores[0]).isEqualTo(Float.POSITIVE_INFINITY);
        assertThat(scores[1]).isCloseTo(1f, within(1e-6f));
    }

    @Test
    @DisplayName("Should preserve the input length")
    void shouldPreserveLength() {
        assertThat(Scorer.score(new float[] {1f, 2f, 3f, 4f, 5f}, 21)).hasSize(5);
    }
}
