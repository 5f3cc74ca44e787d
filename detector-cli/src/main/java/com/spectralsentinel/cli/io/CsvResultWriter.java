package com.spectralsentinel.cli.io;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.spectralsentinel.cli.TimestampFormat;
import com.spectralsentinel.core.model.DetectionResult;
import com.spectralsentinel.core.model.Sample;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Writes {@code Time,value,saliency,score,output} with a header line.
 */
public class CsvResultWriter implements ResultWriter {

    private final CsvMapper mapper;
    private final CsvSchema schema;
    private final TimestampFormat timeFormat;

    public CsvResultWriter(TimestampFormat timeFormat) {
        this.timeFormat = Objects.requireNonNull(timeFormat, "timeFormat must not be null");
        this.mapper = new CsvMapper();
        // quote only values containing separators, quotes or line breaks
        mapper.enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING);
        mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        this.schema = mapper.schemaFor(ResultRow.class).withHeader();
    }

    @Override
    public void write(List<Sample> samples, DetectionResult result, Writer target) {
        List<ResultRow> rows = ResultRow.join(samples, result, timeFormat);
        try (SequenceWriter out = mapper.writer(schema).writeValues(target)) {
            out.writeAll(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV output", e);
        }
        try {
            target.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush CSV output", e);
        }
    }
}
