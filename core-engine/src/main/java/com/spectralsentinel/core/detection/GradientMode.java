package com.spectralsentinel.core.detection;

import java.util.Locale;

/**
 * How {@link Extrapolator} measures the index distance between the last point
 * and each of the points preceding it.
 *
 * @since 1.0.0
 */
public enum GradientMode {

    /**
     * Index distance taken as the unsigned 64-bit wrapping difference
     * {@code i - last}. For every preceding point that distance is close to
     * 2<sup>64</sup>, so the averaged gradient is effectively zero and the
     * padding value collapses to {@code data[last - m + 1]}. Reproduces the
     * output of the reference command-line tool.
     */
    COMPATIBLE,

    /**
     * Signed index distance: the padding continues the linear trend of the
     * trailing window.
     */
    SIGNED;

    /**
     * Resolve a mode from its configuration name, ignoring case.
     *
     * @param name {@code "compatible"} or {@code "signed"}
     * @return the matching mode
     * @throws IllegalArgumentException if the name is unknown or {@code null}
     */
    public static GradientMode fromName(String name) {
        if (name != null) {
            for (GradientMode mode : values()) {
                if (mode.name().equalsIgnoreCase(name.trim())) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown gradient mode: '" + name
                + "'. Supported: compatible, signed");
    }

    /**
     * @return lowercase configuration name
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
