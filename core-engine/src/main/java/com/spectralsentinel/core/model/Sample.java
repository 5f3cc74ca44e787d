package com.spectralsentinel.core.model;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A single observation of the measured series.
 *
 * <p>
 * The timestamp is carried through detection untouched; only the value takes
 * part in the computation.
 * </p>
 *
 * @since 1.0.0
 */
public final class Sample {

    private final LocalDateTime time;
    private final float value;

    /**
     * @param time  observation time; must not be {@code null}
     * @param value measured value
     * @throws NullPointerException if {@code time} is {@code null}
     */
    public Sample(LocalDateTime time, float value) {
        this.time = Objects.requireNonNull(time, "Sample time must not be null");
        this.value = value;
    }

    public LocalDateTime getTime() {
        return time;
    }

    public float getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Sample that))
            return false;
        return Float.compare(value, that.value) == 0 && time.equals(that.time);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, value);
    }

    @Override
    public String toString() {
        return "Sample{time=" + time + ", value=" + value + '}';
    }
}
