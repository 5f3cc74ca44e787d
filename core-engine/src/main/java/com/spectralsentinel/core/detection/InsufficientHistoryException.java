package com.spectralsentinel.core.detection;

/**
 * Thrown when the extrapolation window asks for more trailing points than the
 * series holds.
 *
 * @since 1.0.0
 */
public class InsufficientHistoryException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int available;

    /**
     * @param required  number of trailing points requested ({@code m})
     * @param available length of the series
     */
    public InsufficientHistoryException(int required, int available) {
        super("Extrapolation window m=" + required
                + " exceeds the series length " + available);
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
