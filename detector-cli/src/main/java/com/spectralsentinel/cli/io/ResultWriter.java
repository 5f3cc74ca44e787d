package com.spectralsentinel.cli.io;

import com.spectralsentinel.core.model.DetectionResult;
import com.spectralsentinel.core.model.Sample;

import java.io.Writer;
import java.util.List;

/**
 * Renders a detected series.
 */
public interface ResultWriter {

    /**
     * Write every sample with its saliency, score and flag. The target is
     * flushed but not closed.
     *
     * @throws IllegalArgumentException     if {@code samples} and {@code result} differ in length
     * @throws java.io.UncheckedIOException if writing fails
     */
    void write(List<Sample> samples, DetectionResult result, Writer target);
}
