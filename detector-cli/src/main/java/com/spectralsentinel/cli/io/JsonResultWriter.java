package com.spectralsentinel.cli.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.spectralsentinel.cli.TimestampFormat;
import com.spectralsentinel.core.model.DetectionResult;
import com.spectralsentinel.core.model.Sample;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Writes the series as a JSON array of row objects. Non-finite floats are
 * written as the strings {@code "NaN"}, {@code "Infinity"} and
 * {@code "-Infinity"}.
 */
public class JsonResultWriter implements ResultWriter {

    private final ObjectMapper mapper;
    private final TimestampFormat timeFormat;

    public JsonResultWriter(TimestampFormat timeFormat) {
        this.timeFormat = Objects.requireNonNull(timeFormat, "timeFormat must not be null");
        this.mapper = new ObjectMapper();
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Override
    public void write(List<Sample> samples, DetectionResult result, Writer target) {
        List<ResultRow> rows = ResultRow.join(samples, result, timeFormat);
        try {
            mapper.writeValue(target, rows);
            target.write('\n');
            target.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON output", e);
        }
    }
}
